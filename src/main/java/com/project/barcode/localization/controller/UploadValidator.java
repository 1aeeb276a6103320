package com.project.barcode.localization.controller;

import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.List;

/**
 * Checks uploads before anything is stored or decoded.
 */
@Component
public class UploadValidator {

    static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp", "image/webp"
    );
    static final long MAX_SIZE = 10 * 1024 * 1024; // 10MB

    public void validate(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a file to upload");
        }

        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException(
                    "Unsupported file format: " + contentType +
                            ". Supported formats: " + String.join(", ", SUPPORTED_FORMATS)
            );
        }

        if (file.getSize() > MAX_SIZE) {
            throw new IllegalArgumentException("File is too large. Maximum size: 10MB");
        }
    }

    public String supportedFormats() {
        return String.join(", ", SUPPORTED_FORMATS);
    }
}
