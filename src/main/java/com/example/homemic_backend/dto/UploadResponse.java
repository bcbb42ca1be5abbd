package com.example.homemic_backend.dto;

import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.util.ClipStatus;

import java.time.Instant;
import java.util.UUID;

public record UploadResponse(
        UUID clipId,
        String nodeId,
        ClipStatus status,
        String filename,
        double durationSeconds,
        long fileSize,
        Instant recordedAt,
        String message
) {
    public static UploadResponse from(Clip c) {
        return new UploadResponse(
                c.getId(),
                c.getNodeId(),
                c.getStatus(),
                c.getFilename(),
                c.getDurationSeconds(),
                c.getFileSize(),
                c.getRecordedAt(),
                c.isPrivacySuppressed() ? c.getErrorMessage() : "queued for transcription"
        );
    }
}
