package com.project.barcode.localization.DTOs;

import java.util.List;

public record DetectionResult(
        int width,
        int height,
        int tileWidth,
        int tileHeight,
        int columns,
        int rows,
        List<BandScores> bands,    // top to bottom
        List<BarcodeRegion> regions // band-major, column-minor
) {
    public DetectionResult {
        bands = List.copyOf(bands);
        regions = List.copyOf(regions);
    }

    public int regionCount() {
        return regions.size();
    }
}
