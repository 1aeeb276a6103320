package com.project.barcode.localization.controller;

import com.project.barcode.localization.DTOs.DetectionResponse;
import com.project.barcode.localization.DTOs.DetectionResult;
import com.project.barcode.localization.config.DetectionSettings;
import com.project.barcode.localization.service.BarcodeDetectionService;
import com.project.barcode.localization.service.EmissionPolicy;
import com.project.barcode.localization.service.ImageDecoder;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * JSON variant of the detection flow. Nothing is stored; the response carries the regions and
 * every band's score row.
 */
@RestController
@RequestMapping("/api")
@Validated
public class DetectionApiController {
    private static final Logger log = LoggerFactory.getLogger(DetectionApiController.class);

    private final BarcodeDetectionService detectionService;
    private final ImageDecoder imageDecoder;
    private final UploadValidator uploadValidator;
    private final DetectionSettings defaults;

    public DetectionApiController(BarcodeDetectionService detectionService, ImageDecoder imageDecoder,
                                  UploadValidator uploadValidator, DetectionSettings defaults) {
        this.detectionService = detectionService;
        this.imageDecoder = imageDecoder;
        this.uploadValidator = uploadValidator;
        this.defaults = defaults;
    }

    @PostMapping(value = "/detect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public DetectionResponse detect(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "numCols", required = false) @Min(1) @Max(1000) Integer numCols,
            @RequestParam(name = "tileHeight", required = false) @Min(1) @Max(10000) Integer tileHeight,
            @RequestParam(name = "threshold", required = false) @DecimalMin("0.0") Double threshold,
            @RequestParam(name = "consecutiveThreshold", required = false) @Min(1) @Max(1000) Integer consecutiveThreshold,
            @RequestParam(name = "emissionPolicy", required = false) EmissionPolicy emissionPolicy
    ) throws IOException {
        uploadValidator.validate(file);
        DetectionSettings settings = defaults.overriddenBy(numCols, tileHeight, threshold, consecutiveThreshold);
        if (emissionPolicy != null) {
            settings = settings.withEmissionPolicy(emissionPolicy);
        }
        log.info("API detection for {} with {}", file.getOriginalFilename(), settings);

        DetectionResult result = detectionService.detect(imageDecoder.decode(file.getBytes()), settings);
        return DetectionResponse.from(result);
    }
}
