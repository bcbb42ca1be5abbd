package com.example.homemic_backend.dto;

import com.example.homemic_backend.model.Node;
import com.example.homemic_backend.util.NodeStatus;

import java.time.Instant;

public record NodeResponse(
        String id,
        String name,
        String location,
        String ipAddress,
        NodeStatus status,
        boolean audioFiltering,
        Instant lastSeen,
        double latencyMs,
        boolean enabled
) {
    /**
     * @param status freshly derived status; the stored one may be stale between sweeps
     */
    public static NodeResponse from(Node n, NodeStatus status) {
        return new NodeResponse(
                n.getId(),
                n.getName(),
                n.getLocation(),
                n.getIpAddress(),
                status,
                n.isAudioFiltering(),
                n.getLastSeen(),
                n.getLatencyMs(),
                n.isEnabled()
        );
    }
}
