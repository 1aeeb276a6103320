package com.project.barcode.localization.config;

import com.project.barcode.localization.service.StorageService;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Publishes the storage root under /uploads/**: uploaded images, overlays, and each run's
 * sections/ crops and score charts. Paths match {@link StorageService#relativeWebPath}.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    static final String WEB_PREFIX = "/uploads/**";

    private final StorageService storageService;

    public StaticResourceConfig(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler(WEB_PREFIX)
                .addResourceLocations(storageService.rootDir().toUri().toString());
    }
}
