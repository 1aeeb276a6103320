package com.project.barcode.localization.DTOs;

import java.util.List;

/**
 * Scores of one horizontal band, one per tile column, left to right, plus the regions
 * that band contributed.
 */
public record BandScores(
        int bandIndex,
        int yStart,
        int yEnd,
        double[] scores,
        List<BarcodeRegion> regions
) {
    public BandScores {
        scores = scores.clone();
        regions = List.copyOf(regions);
    }

    @Override
    public double[] scores() {
        return scores.clone();
    }
}
