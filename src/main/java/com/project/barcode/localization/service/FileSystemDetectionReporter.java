package com.project.barcode.localization.service;

import com.project.barcode.localization.DTOs.BarcodeRegion;
import com.project.barcode.localization.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.imageio.ImageIO;

/**
 * Writes band crops to {@code sections/section_<band>.png} and score charts to
 * {@code section_magnitudes_<band>_height.png} inside one run directory.
 */
public class FileSystemDetectionReporter implements DetectionReporter {
    private static final Logger log = LoggerFactory.getLogger(FileSystemDetectionReporter.class);

    private final Path runDir;
    private final ScoreChartRenderer chartRenderer;
    private final List<Path> crops = new ArrayList<>();
    private final List<Path> charts = new ArrayList<>();

    public FileSystemDetectionReporter(Path runDir, ScoreChartRenderer chartRenderer) {
        this.runDir = runDir;
        this.chartRenderer = chartRenderer;
    }

    @Override
    public void saveBandCrop(int bandIndex, BufferedImage slice) {
        Path target = runDir.resolve(StorageService.SECTIONS_DIR).resolve("section_" + bandIndex + ".png");
        try {
            if (!ImageIO.write(slice, "png", target.toFile())) {
                throw new StorageException("No PNG writer available for band " + bandIndex);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to save section image: " + target, e);
        }
        crops.add(target);
        log.info("Saved section image: {}", target);
    }

    @Override
    public void renderScoreChart(int bandIndex, double[] scores, List<BarcodeRegion> regions,
                                 int tileWidth, int tileHeight) {
        Path target = runDir.resolve("section_magnitudes_" + bandIndex + "_height.png");
        try {
            chartRenderer.render(target.toFile(), bandIndex, scores, regions, tileWidth, tileHeight);
        } catch (IOException e) {
            throw new StorageException("Failed to render score chart: " + target, e);
        }
        charts.add(target);
        log.debug("Rendered score chart: {}", target);
    }

    public Path runDir() {
        return runDir;
    }

    public List<Path> crops() {
        return Collections.unmodifiableList(crops);
    }

    public List<Path> charts() {
        return Collections.unmodifiableList(charts);
    }
}
