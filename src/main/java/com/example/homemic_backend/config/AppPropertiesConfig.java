package com.example.homemic_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({
        IngestProperties.class,
        HealthProperties.class,
        PrivacyProperties.class,
        EventsProperties.class,
        RetentionProperties.class
})
public class AppPropertiesConfig {
}
