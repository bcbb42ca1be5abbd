package com.example.homemic_backend.config;

import com.example.homemic_backend.service.Interfaces.AudioStorage;
import com.example.homemic_backend.service.LocalAudioStorage;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public AudioStorage audioStorage(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        var storage = new LocalAudioStorage(base, properties.getAudioPrefix());
        LoggerFactory.getLogger(StorageConfig.class)
                .info("Storage wired: base={}, audioPrefix={}", base, properties.getAudioPrefix());
        return storage;
    }
}
