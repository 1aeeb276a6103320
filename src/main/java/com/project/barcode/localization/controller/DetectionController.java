package com.project.barcode.localization.controller;

import com.project.barcode.localization.DTOs.BandScores;
import com.project.barcode.localization.DTOs.DetectionResult;
import com.project.barcode.localization.config.DetectionSettings;
import com.project.barcode.localization.exceptions.DetectionException;
import com.project.barcode.localization.service.BarcodeDetectionService;
import com.project.barcode.localization.service.DetectionReporter;
import com.project.barcode.localization.service.FileSystemDetectionReporter;
import com.project.barcode.localization.service.ImageDecoder;
import com.project.barcode.localization.service.OverlayRenderer;
import com.project.barcode.localization.service.ReporterFactory;
import com.project.barcode.localization.service.StorageService;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Controller
@Validated
public class DetectionController {
    private static final Logger log = LoggerFactory.getLogger(DetectionController.class);

    private final BarcodeDetectionService detectionService;
    private final StorageService storageService;
    private final ImageDecoder imageDecoder;
    private final OverlayRenderer overlayRenderer;
    private final ReporterFactory reporterFactory;
    private final UploadValidator uploadValidator;
    private final DetectionSettings defaults;

    public DetectionController(BarcodeDetectionService detectionService, StorageService storageService,
                               ImageDecoder imageDecoder, OverlayRenderer overlayRenderer,
                               ReporterFactory reporterFactory, UploadValidator uploadValidator,
                               DetectionSettings defaults) {
        this.detectionService = detectionService;
        this.storageService = storageService;
        this.imageDecoder = imageDecoder;
        this.overlayRenderer = overlayRenderer;
        this.reporterFactory = reporterFactory;
        this.uploadValidator = uploadValidator;
        this.defaults = defaults;
    }

    @GetMapping("/detect")
    public String showForm(Model model) {
        model.addAttribute("defaults", defaults);
        model.addAttribute("supportedFormats", uploadValidator.supportedFormats());
        return "detect";
    }

    @PostMapping(value = "/detect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "numCols", required = false) @Min(1) @Max(1000) Integer numCols,
            @RequestParam(name = "tileHeight", required = false) @Min(1) @Max(10000) Integer tileHeight,
            @RequestParam(name = "threshold", required = false) @DecimalMin("0.0") Double threshold,
            @RequestParam(name = "consecutiveThreshold", required = false) @Min(1) @Max(1000) Integer consecutiveThreshold,
            Model model
    ) throws IOException {

        uploadValidator.validate(file);
        DetectionSettings settings = defaults.overriddenBy(numCols, tileHeight, threshold, consecutiveThreshold);

        log.info("Processing file: {} ({}KB), settings: {}",
                file.getOriginalFilename(), file.getSize() / 1024, settings);

        var storedOriginal = storageService.store(file);
        log.debug("File stored as: {}", storedOriginal.filename());

        BufferedImage input = imageDecoder.decode(file.getBytes());

        try {
            DetectionReporter reporter = reporterFactory.open(storedOriginal.filename());
            DetectionResult result = detectionService.detect(input, settings, reporter);

            var overlayStored = storageService.storeResultImage(overlayRenderer.renderPng(input, result.regions()));

            model.addAttribute("originalPath", "/" + storedOriginal.relativeWebPath());
            model.addAttribute("overlayPath", "/" + overlayStored.relativeWebPath());
            model.addAttribute("chartPaths", chartPaths(reporter));
            model.addAttribute("regions", result.regions());
            model.addAttribute("regionCount", result.regionCount());
            model.addAttribute("bands", summarize(result.bands()));
            model.addAttribute("width", result.width());
            model.addAttribute("height", result.height());
            model.addAttribute("tileWidth", result.tileWidth());
            model.addAttribute("tileHeight", result.tileHeight());
            model.addAttribute("settings", settings);

            log.info("Detection completed for {}: {} region(s)", file.getOriginalFilename(), result.regionCount());
            return "result";

        } catch (DetectionException e) {
            log.warn("Detection failed for {}: {}", file.getOriginalFilename(), e.getMessage());
            model.addAttribute("error", e.getMessage());
            model.addAttribute("defaults", defaults);
            model.addAttribute("supportedFormats", uploadValidator.supportedFormats());
            return "detect";
        }
    }

    private List<String> chartPaths(DetectionReporter reporter) {
        List<String> paths = new ArrayList<>();
        if (reporter instanceof FileSystemDetectionReporter fileReporter) {
            fileReporter.charts().forEach(chart -> paths.add("/" + storageService.relativeWebPath(chart)));
        }
        return paths;
    }

    private static List<BandSummary> summarize(List<BandScores> bands) {
        List<BandSummary> summaries = new ArrayList<>();
        for (BandScores band : bands) {
            double max = 0.0;
            int active = 0;
            for (double score : band.scores()) {
                if (score > 0.0) {
                    active++;
                    max = Math.max(max, score);
                }
            }
            summaries.add(new BandSummary(band.bandIndex(), band.yStart(), band.yEnd(), active,
                    String.format("%.2f", max), band.regions().size()));
        }
        return summaries;
    }

    public record BandSummary(int index, int yStart, int yEnd, int activeColumns, String maxScore, int regions) {}
}
