package com.example.homemic_backend.dto;

import com.example.homemic_backend.model.Speaker;

import java.time.Instant;
import java.util.UUID;

public record SpeakerResponse(UUID id, String name, String color, int sampleCount, Instant enrolledAt) {
    public static SpeakerResponse from(Speaker s) {
        return new SpeakerResponse(s.getId(), s.getName(), s.getColor(), s.getSampleCount(), s.getEnrolledAt());
    }
}
