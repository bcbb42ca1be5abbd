package com.example.homemic_backend.service.events;

import com.example.homemic_backend.util.NodeStatus;

import java.time.Instant;

public record NodeStatusEvent(String nodeId,
                              String name,
                              String location,
                              NodeStatus status,
                              NodeStatus previousStatus,
                              Instant lastSeen,
                              double latencyMs) implements PipelineEvent {
    public static final String TYPE = "node_status";

    @Override
    public String type() {
        return TYPE;
    }
}
