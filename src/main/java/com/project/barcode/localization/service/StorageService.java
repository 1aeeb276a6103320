package com.project.barcode.localization.service;

import com.project.barcode.localization.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    static final String SECTIONS_DIR = "sections";

    private final Path rootDir;

    public StorageService(@Value("${app.upload.dir:uploads}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDir);
            log.info("Using upload directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + rootDir, e);
        }
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    public Path rootDir() {
        return rootDir;
    }

    public StoredFile store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new StorageException("Only image uploads are allowed (received: " + contentType + ")");
        }
        String filename = timestamp() + "_" + safeName(file.getOriginalFilename());
        Path target = rootDir.resolve(filename);
        try {
            Files.copy(file.getInputStream(), target, StandardCopyOption.REPLACE_EXISTING);
            return new StoredFile(target, filename, relativeWebPath(target));
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    public StoredFile storeResultImage(byte[] pngBytes) {
        String filename = timestamp() + "_result.png";
        Path target = rootDir.resolve(filename);
        try {
            Files.write(target, pngBytes);
            return new StoredFile(target, filename, relativeWebPath(target));
        } catch (IOException e) {
            throw new StorageException("Failed to store result image", e);
        }
    }

    /**
     * Creates {@code <root>/<timestamp>_<label>/sections} for the artifacts of one detection run
     * and returns the run directory.
     */
    public Path createRunDirectory(String label) {
        Path runDir = rootDir.resolve(timestamp() + "_" + safeName(label));
        try {
            Files.createDirectories(runDir.resolve(SECTIONS_DIR));
            log.debug("Created run directory {}", runDir);
            return runDir;
        } catch (IOException e) {
            throw new StorageException("Cannot create run directory: " + runDir, e);
        }
    }

    /** Web path ({@code uploads/...}) of a file stored below the upload root. */
    public String relativeWebPath(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        if (!normalized.startsWith(rootDir)) {
            throw new StorageException("Path is outside the upload directory: " + file);
        }
        return "uploads/" + rootDir.relativize(normalized).toString().replace('\\', '/');
    }

    private static String timestamp() {
        return TIMESTAMP.format(LocalDateTime.now());
    }

    private static String safeName(String original) {
        String cleaned = StringUtils.cleanPath(original == null || original.isBlank() ? "upload" : original);
        return cleaned.replaceAll("[^a-zA-Z0-9._-]", "_");
    }
}
