package com.example.homemic_backend.service.events;

import java.time.Instant;
import java.util.UUID;

public record TranscriptionEvent(UUID clipId,
                                 String nodeId,
                                 String text,
                                 int wordCount,
                                 int segmentCount,
                                 double durationSeconds,
                                 Instant recordedAt,
                                 Instant processedAt) implements PipelineEvent {
    public static final String TYPE = "transcription";

    @Override
    public String type() {
        return TYPE;
    }
}
