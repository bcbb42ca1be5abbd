package com.example.homemic_backend.dto;

import com.example.homemic_backend.model.PrivacyZone;

import java.time.Instant;
import java.util.UUID;

public record PrivacyZoneResponse(UUID id, String nodeId, String reason, Instant startTime, Instant endTime, boolean active) {
    public static PrivacyZoneResponse from(PrivacyZone z) {
        return new PrivacyZoneResponse(z.getId(), z.getNodeId(), z.getReason(), z.getStartTime(), z.getEndTime(), z.isActive());
    }
}
