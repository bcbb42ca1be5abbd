package com.example.homemic_backend.dto;

import com.example.homemic_backend.model.KeywordDetection;

import java.time.Instant;
import java.util.UUID;

public record KeywordDetectionResponse(UUID id, UUID keywordId, UUID clipId, String snippet, Instant detectedAt) {
    public static KeywordDetectionResponse from(KeywordDetection d) {
        return new KeywordDetectionResponse(
                d.getId(),
                d.getKeyword().getId(),
                d.getClip().getId(),
                d.getSnippet(),
                d.getDetectedAt()
        );
    }
}
