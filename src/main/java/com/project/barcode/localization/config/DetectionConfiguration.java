package com.project.barcode.localization.config;

import com.project.barcode.localization.service.EmissionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the {@code app.detection.*} properties into the default {@link DetectionSettings}.
 * Requests may override the grid and thresholds per call.
 */
@Configuration
public class DetectionConfiguration {
    private static final Logger log = LoggerFactory.getLogger(DetectionConfiguration.class);

    @Bean
    public DetectionSettings defaultDetectionSettings(
            @Value("${app.detection.num-cols:60}") int columns,
            @Value("${app.detection.tile-height:100}") int tileHeight,
            @Value("${app.detection.threshold:50.0}") double threshold,
            @Value("${app.detection.consecutive-threshold:5}") int consecutiveThreshold,
            @Value("${app.detection.emission-policy:GROWING}") EmissionPolicy emissionPolicy) {
        DetectionSettings settings =
                new DetectionSettings(columns, tileHeight, threshold, consecutiveThreshold, emissionPolicy);
        log.info("Default detection settings: {}", settings);
        return settings;
    }
}
