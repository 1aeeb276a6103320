package com.project.barcode.localization.cli;

import com.project.barcode.localization.DTOs.DetectionResult;
import com.project.barcode.localization.config.DetectionSettings;
import com.project.barcode.localization.service.BarcodeDetectionService;
import com.project.barcode.localization.service.FileSystemDetectionReporter;
import com.project.barcode.localization.service.ImageDecoder;
import com.project.barcode.localization.service.ReporterFactory;
import com.project.barcode.localization.service.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * One-shot detection on a file given as {@code --image=<path>}. Band crops and score charts go to
 * {@code --output=<dir>}, or to a fresh run directory under the upload root. Any failure propagates
 * and stops the application.
 */
@Component
public class BatchDetectionRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchDetectionRunner.class);

    static final String IMAGE_OPTION = "image";
    static final String OUTPUT_OPTION = "output";

    private final ImageDecoder imageDecoder;
    private final BarcodeDetectionService detectionService;
    private final ReporterFactory reporterFactory;
    private final StorageService storageService;
    private final DetectionSettings settings;

    public BatchDetectionRunner(ImageDecoder imageDecoder, BarcodeDetectionService detectionService,
                                ReporterFactory reporterFactory, StorageService storageService,
                                DetectionSettings settings) {
        this.imageDecoder = imageDecoder;
        this.detectionService = detectionService;
        this.reporterFactory = reporterFactory;
        this.storageService = storageService;
        this.settings = settings;
    }

    @Override
    public void run(ApplicationArguments args) {
        String image = firstValue(args, IMAGE_OPTION);
        if (image == null) {
            return;
        }
        Path imagePath = Paths.get(image).toAbsolutePath().normalize();
        String output = firstValue(args, OUTPUT_OPTION);
        Path runDir = output != null
                ? Paths.get(output).toAbsolutePath().normalize()
                : storageService.createRunDirectory(String.valueOf(imagePath.getFileName()));

        log.info("Batch detection of {} into {}", imagePath, runDir);
        BufferedImage input = imageDecoder.decode(imagePath);
        FileSystemDetectionReporter reporter = reporterFactory.openAt(runDir);
        DetectionResult result = detectionService.detect(input, settings, reporter);
        log.info("Batch detection wrote {} section image(s) and {} chart(s); {} region(s) found",
                reporter.crops().size(), reporter.charts().size(), result.regionCount());
    }

    private static String firstValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
