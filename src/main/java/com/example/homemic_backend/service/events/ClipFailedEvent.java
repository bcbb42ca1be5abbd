package com.example.homemic_backend.service.events;

import java.time.Instant;
import java.util.UUID;

/**
 * A clip reached the terminal {@code failed} state after exhausting its attempts.
 */
public record ClipFailedEvent(UUID clipId,
                              String nodeId,
                              String errorMessage,
                              int attempts,
                              Instant failedAt) implements PipelineEvent {
    public static final String TYPE = "clip_failed";

    @Override
    public String type() {
        return TYPE;
    }
}
