package com.example.homemic_backend.dto;

import com.example.homemic_backend.model.Keyword;
import com.example.homemic_backend.util.KeywordPriority;

import java.time.Instant;
import java.util.UUID;

public record KeywordResponse(
        UUID id,
        String phrase,
        String category,
        KeywordPriority priority,
        boolean caseSensitive,
        boolean enabled,
        long detectionCount,
        Instant lastDetected,
        Instant createdAt
) {
    public static KeywordResponse from(Keyword k) {
        return new KeywordResponse(
                k.getId(),
                k.getPhrase(),
                k.getCategory(),
                k.getPriority(),
                k.isCaseSensitive(),
                k.isEnabled(),
                k.getDetectionCount(),
                k.getLastDetected(),
                k.getCreatedAt()
        );
    }
}
