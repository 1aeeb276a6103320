package com.project.barcode.localization.service;

import com.project.barcode.localization.DTOs.BandScores;
import com.project.barcode.localization.DTOs.BarcodeRegion;
import com.project.barcode.localization.DTOs.DetectionResult;
import com.project.barcode.localization.config.DetectionSettings;
import com.project.barcode.localization.exceptions.DetectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;

/**
 * Runs barcode localization on a decoded image and hands every band to a reporter.
 */
@Service
public class BarcodeDetectionService {
    private static final Logger log = LoggerFactory.getLogger(BarcodeDetectionService.class);

    private final TileGridScanner scanner;

    public BarcodeDetectionService(TileGridScanner scanner) {
        this.scanner = scanner;
    }

    public DetectionResult detect(BufferedImage input, DetectionSettings settings) {
        return detect(input, settings, NoOpDetectionReporter.INSTANCE);
    }

    public DetectionResult detect(BufferedImage input, DetectionSettings settings, DetectionReporter reporter) {
        if (input == null) {
            throw new DetectionException("No image to scan.");
        }

        log.info("Starting barcode detection for image {}x{}, columns={}, tileHeight={}, threshold={}, run={}",
                input.getWidth(), input.getHeight(), settings.columns(), settings.tileHeight(),
                settings.threshold(), settings.consecutiveThreshold());

        LuminanceImage luminance = LuminanceImage.fromBufferedImage(input);
        DetectionResult result = scanner.scan(luminance, settings, (grid, band) -> report(luminance, grid, band, reporter));

        for (BarcodeRegion region : result.regions()) {
            log.info("Barcode region: x_start = {}, x_end = {}, y_start = {}, y_end = {}",
                    region.xStart(), region.xEnd(), region.yStart(), region.yEnd());
        }
        log.info("Detection finished: {} band(s), {} region(s)", result.rows(), result.regionCount());
        return result;
    }

    private static void report(LuminanceImage luminance, TileGrid grid, BandScores band, DetectionReporter reporter) {
        // crops come from the scanned luma raster, not the colour source
        reporter.saveBandCrop(band.bandIndex(), luminance.band(band.yStart(), band.yEnd() - band.yStart()));
        reporter.renderScoreChart(band.bandIndex(), band.scores(), band.regions(),
                grid.tileWidth(), grid.tileHeight());
    }
}
