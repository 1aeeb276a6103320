package com.project.barcode.localization.service;

import com.project.barcode.localization.DTOs.BarcodeRegion;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Receives presentation artifacts of a detection run. Nothing a reporter does feeds back into
 * detection; a failing reporter aborts the run by throwing.
 */
public interface DetectionReporter {

    /** Persists the full-width slice of the source image covered by one band. */
    void saveBandCrop(int bandIndex, BufferedImage slice);

    /** Renders the score row of one band, highlighting columns that fall inside a region. */
    void renderScoreChart(int bandIndex, double[] scores, List<BarcodeRegion> regions,
                          int tileWidth, int tileHeight);
}
