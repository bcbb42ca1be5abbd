package com.example.homemic_backend.dto;

import com.example.homemic_backend.model.QuietHours;

import java.time.LocalTime;
import java.util.UUID;

public record QuietHoursResponse(UUID id, String label, LocalTime start, LocalTime end, boolean enabled) {
    public static QuietHoursResponse from(QuietHours q) {
        return new QuietHoursResponse(q.getId(), q.getLabel(), q.getStartTime(), q.getEndTime(), q.isEnabled());
    }
}
