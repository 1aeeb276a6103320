package com.project.barcode.localization.service;

/**
 * Logical partition of an image into {@code columns} equal-width tiles and {@code rows} bands of
 * {@code tileHeight} pixels. Sizes come from integer division: leftover pixels on the right and
 * at the bottom are never scanned.
 */
public record TileGrid(int tileWidth, int tileHeight, int columns, int rows) {

    public static TileGrid derive(int imageWidth, int imageHeight, int columns, int tileHeight) {
        if (columns < 1) {
            throw new IllegalArgumentException("Column count must be positive, got " + columns);
        }
        if (tileHeight < 1) {
            throw new IllegalArgumentException("Tile height must be positive, got " + tileHeight);
        }
        if (columns > imageWidth) {
            throw new IllegalArgumentException("Column count " + columns
                    + " exceeds image width " + imageWidth + " (tiles would be zero pixels wide)");
        }
        return new TileGrid(imageWidth / columns, tileHeight, columns, imageHeight / tileHeight);
    }

    public int scannedWidth() {
        return tileWidth * columns;
    }

    public int scannedHeight() {
        return tileHeight * rows;
    }

    public int bandStart(int band) {
        return band * tileHeight;
    }

    public int columnStart(int column) {
        return column * tileWidth;
    }
}
