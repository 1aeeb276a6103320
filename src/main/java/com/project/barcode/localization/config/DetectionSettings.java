package com.project.barcode.localization.config;

import com.project.barcode.localization.service.EmissionPolicy;

/**
 * Tunables of one detection run.
 *
 * @param columns             number of equal-width tile columns across the image
 * @param tileHeight          band height in pixels
 * @param threshold           minimum spectral score for a column to count as textured
 * @param consecutiveThreshold minimum run of textured columns reported as a region
 * @param emissionPolicy      how regions are reported for runs longer than the minimum
 */
public record DetectionSettings(
        int columns,
        int tileHeight,
        double threshold,
        int consecutiveThreshold,
        EmissionPolicy emissionPolicy
) {
    public static final int DEFAULT_COLUMNS = 60;
    public static final int DEFAULT_TILE_HEIGHT = 100;
    public static final double DEFAULT_THRESHOLD = 50.0;
    public static final int DEFAULT_CONSECUTIVE_THRESHOLD = 5;

    public DetectionSettings {
        if (columns < 1) {
            throw new IllegalArgumentException("columns must be positive, got " + columns);
        }
        if (tileHeight < 1) {
            throw new IllegalArgumentException("tileHeight must be positive, got " + tileHeight);
        }
        if (Double.isNaN(threshold) || threshold < 0.0) {
            throw new IllegalArgumentException("threshold must be a non-negative number, got " + threshold);
        }
        if (consecutiveThreshold < 1) {
            throw new IllegalArgumentException(
                    "consecutiveThreshold must be positive, got " + consecutiveThreshold);
        }
        if (emissionPolicy == null) {
            emissionPolicy = EmissionPolicy.GROWING;
        }
    }

    public static DetectionSettings defaults() {
        return new DetectionSettings(DEFAULT_COLUMNS, DEFAULT_TILE_HEIGHT, DEFAULT_THRESHOLD,
                DEFAULT_CONSECUTIVE_THRESHOLD, EmissionPolicy.GROWING);
    }

    public DetectionSettings withGrid(int columns, int tileHeight) {
        return new DetectionSettings(columns, tileHeight, threshold, consecutiveThreshold, emissionPolicy);
    }

    public DetectionSettings withThresholds(double threshold, int consecutiveThreshold) {
        return new DetectionSettings(columns, tileHeight, threshold, consecutiveThreshold, emissionPolicy);
    }

    public DetectionSettings withEmissionPolicy(EmissionPolicy emissionPolicy) {
        return new DetectionSettings(columns, tileHeight, threshold, consecutiveThreshold, emissionPolicy);
    }

    /** Copy with every non-null argument replacing the current value. */
    public DetectionSettings overriddenBy(Integer columns, Integer tileHeight, Double threshold,
                                          Integer consecutiveThreshold) {
        return new DetectionSettings(
                columns != null ? columns : this.columns,
                tileHeight != null ? tileHeight : this.tileHeight,
                threshold != null ? threshold : this.threshold,
                consecutiveThreshold != null ? consecutiveThreshold : this.consecutiveThreshold,
                emissionPolicy);
    }
}
