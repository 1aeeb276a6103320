package com.project.barcode.localization.service;

import com.project.barcode.localization.exceptions.StorageException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens a reporter for one detection run: file-based when {@code app.report.enabled} is set,
 * otherwise the no-op reporter.
 */
@Component
public class ReporterFactory {

    private final StorageService storageService;
    private final ScoreChartRenderer chartRenderer;
    private final boolean enabled;

    public ReporterFactory(StorageService storageService, ScoreChartRenderer chartRenderer,
                           @Value("${app.report.enabled:true}") boolean enabled) {
        this.storageService = storageService;
        this.chartRenderer = chartRenderer;
        this.enabled = enabled;
    }

    public DetectionReporter open(String label) {
        if (!enabled) {
            return NoOpDetectionReporter.INSTANCE;
        }
        return new FileSystemDetectionReporter(storageService.createRunDirectory(label), chartRenderer);
    }

    /** Reporter writing into an explicit directory, used by the batch runner. */
    public FileSystemDetectionReporter openAt(Path runDir) {
        try {
            Files.createDirectories(runDir.resolve(StorageService.SECTIONS_DIR));
        } catch (IOException e) {
            throw new StorageException("Cannot create output directory: " + runDir, e);
        }
        return new FileSystemDetectionReporter(runDir, chartRenderer);
    }
}
