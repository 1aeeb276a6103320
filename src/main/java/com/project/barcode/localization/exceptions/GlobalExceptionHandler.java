package com.project.barcode.localization.exceptions;

import com.project.barcode.localization.config.DetectionSettings;
import com.project.barcode.localization.controller.UploadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import jakarta.validation.ConstraintViolationException;
import java.io.IOException;

/**
 * Sends failed scans back to the detect form with the message and the configured grid defaults,
 * so the form renders the same as on a fresh GET.
 */
@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String DETECT_VIEW = "detect";

    private final DetectionSettings defaults;
    private final UploadValidator uploadValidator;

    public GlobalExceptionHandler(DetectionSettings defaults, UploadValidator uploadValidator) {
        this.defaults = defaults;
        this.uploadValidator = uploadValidator;
    }

    @ExceptionHandler({StorageException.class, DetectionException.class})
    public String handleDetectionFailure(RuntimeException ex, Model model) {
        log.warn("Scan failed: {}", ex.getMessage());
        return detectForm(model, ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public String handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, Model model) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        return detectForm(model, "File is too large. Maximum size: 10MB");
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public String handleMissingFile(MissingServletRequestPartException ex, Model model) {
        log.warn("Scan submitted without '{}'", ex.getRequestPartName());
        return detectForm(model, "Please choose an image to scan");
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public String handleGridParameters(ConstraintViolationException ex, Model model) {
        log.warn("Grid parameters rejected: {}", ex.getMessage());
        return detectForm(model, "Invalid grid parameters. Columns, band height and minimum run must be at least 1.");
    }

    @ExceptionHandler(IOException.class)
    public String handleIOException(IOException ex, Model model) {
        log.error("Could not read upload", ex);
        return detectForm(model, "The file could not be read. Please try another image.");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public String handleIllegalArgument(IllegalArgumentException ex, Model model) {
        log.warn("Scan rejected: {}", ex.getMessage());
        return detectForm(model, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public String handleUnknownException(Exception ex, Model model) {
        log.error("Unhandled error occurred", ex);
        model.addAttribute("error", "An unexpected error occurred. Please try again.");
        return "index";
    }

    private String detectForm(Model model, String message) {
        model.addAttribute("error", message);
        model.addAttribute("defaults", defaults);
        model.addAttribute("supportedFormats", uploadValidator.supportedFormats());
        return DETECT_VIEW;
    }
}
