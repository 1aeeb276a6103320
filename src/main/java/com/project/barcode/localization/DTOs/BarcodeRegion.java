package com.project.barcode.localization.DTOs;

/** Rectangle flagged as a likely barcode, in image pixels, half-open on both axes. */
public record BarcodeRegion(int xStart, int xEnd, int yStart, int yEnd) {

    public BarcodeRegion {
        if (xStart < 0 || xEnd <= xStart || yEnd <= yStart) {
            throw new IllegalArgumentException(
                    "Invalid region x=[" + xStart + "," + xEnd + ") y=[" + yStart + "," + yEnd + ")");
        }
    }

    public int width() {
        return xEnd - xStart;
    }

    public int height() {
        return yEnd - yStart;
    }

    public boolean contains(int x, int y) {
        return x >= xStart && x < xEnd && y >= yStart && y < yEnd;
    }
}
