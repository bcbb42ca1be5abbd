package com.example.homemic_backend.config;

import com.example.homemic_backend.service.Interfaces.AudioStorage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.file.Files;
import java.time.Duration;
import java.util.Locale;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator audioStorageHealth(AudioStorage storage) {
        return () -> {
            var root = storage.root();
            if (Files.isDirectory(root) && Files.isWritable(root)) {
                return Health.up().withDetail("audioRoot", root.toString()).build();
            }
            return Health.down().withDetail("audioRoot", root.toString()).withDetail("reason", "missing or read-only").build();
        };
    }

    @Bean
    public HealthIndicator transcriberHealth(TranscriberProperties props,
                                             @Qualifier("whisperWebClient") WebClient whisper) {
        return () -> {
            String provider = props.getProvider() == null ? "whisper" : props.getProvider().toLowerCase(Locale.ROOT);
            if ("dummy".equals(provider)) {
                return Health.up().withDetail("provider", provider).build();
            }
            try {
                // light check: any HTTP answer means the server is reachable
                whisper.head().uri("/")
                        .retrieve()
                        .toBodilessEntity()
                        .onErrorResume(WebClientResponseException.class,
                                e -> Mono.empty())
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("provider", provider).withDetail("baseUrl", props.getBaseUrl()).build();
            } catch (Exception e) {
                return Health.down(e).withDetail("provider", provider).withDetail("baseUrl", props.getBaseUrl()).build();
            }
        };
    }
}
