package com.example.homemic_backend.service.events;

import java.time.Instant;
import java.util.List;

public record InitialStateEvent(List<TranscriptionEvent> recentTranscriptions,
                                List<NodeStatusEvent> nodes,
                                Instant generatedAt) implements PipelineEvent {
    public static final String TYPE = "initial_state";

    public InitialStateEvent {
        recentTranscriptions = recentTranscriptions == null ? List.of() : List.copyOf(recentTranscriptions);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
