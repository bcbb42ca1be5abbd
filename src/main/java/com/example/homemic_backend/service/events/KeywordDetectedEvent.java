package com.example.homemic_backend.service.events;

import com.example.homemic_backend.util.KeywordPriority;

import java.time.Instant;
import java.util.UUID;

public record KeywordDetectedEvent(UUID keywordId,
                                   String phrase,
                                   String category,
                                   KeywordPriority priority,
                                   UUID clipId,
                                   String nodeId,
                                   String snippet,
                                   Instant detectedAt) implements PipelineEvent {
    public static final String TYPE = "keyword_detected";

    @Override
    public String type() {
        return TYPE;
    }
}
