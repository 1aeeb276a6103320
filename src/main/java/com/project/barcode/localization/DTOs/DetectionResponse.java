package com.project.barcode.localization.DTOs;

import java.util.List;

/** JSON body of {@code POST /api/detect}. */
public record DetectionResponse(
        int width,
        int height,
        int tileWidth,
        int tileHeight,
        int columns,
        int rows,
        int regionCount,
        List<BarcodeRegion> regions,
        List<BandScores> bands
) {
    public static DetectionResponse from(DetectionResult result) {
        return new DetectionResponse(result.width(), result.height(), result.tileWidth(), result.tileHeight(),
                result.columns(), result.rows(), result.regionCount(), result.regions(), result.bands());
    }
}
