package com.project.barcode.localization.service;

import com.project.barcode.localization.DTOs.BarcodeRegion;
import java.awt.image.BufferedImage;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reporter used when artifact output is disabled.
 */
public class NoOpDetectionReporter implements DetectionReporter {
    private static final Logger log = LoggerFactory.getLogger(NoOpDetectionReporter.class);

    public static final NoOpDetectionReporter INSTANCE = new NoOpDetectionReporter();

    private NoOpDetectionReporter() {
    }

    @Override
    public void saveBandCrop(int bandIndex, BufferedImage slice) {
        log.trace("Skipping crop for band {}", bandIndex);
    }

    @Override
    public void renderScoreChart(int bandIndex, double[] scores, List<BarcodeRegion> regions,
                                 int tileWidth, int tileHeight) {
        log.trace("Skipping chart for band {}", bandIndex);
    }
}
