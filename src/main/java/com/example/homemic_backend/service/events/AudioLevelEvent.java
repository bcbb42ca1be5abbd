package com.example.homemic_backend.service.events;

import java.time.Instant;

public record AudioLevelEvent(String nodeId, double level, double peak, Instant at) implements PipelineEvent {
    public static final String TYPE = "audio_level";

    @Override
    public String type() {
        return TYPE;
    }
}
