package com.example.homemic_backend.dto;

import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.util.ClipStatus;
import com.example.homemic_backend.util.TranscriptUtil;

import java.time.Instant;
import java.util.UUID;

public record ClipSummary(
        UUID id,
        String nodeId,
        String filename,
        String displayName,
        double durationSeconds,
        Instant recordedAt,
        ClipStatus status,
        int wordCount,
        String transcriptPreview,
        String errorMessage,
        boolean privacySuppressed
) {
    private static final int PREVIEW_CHARS = 200;

    public static ClipSummary from(Clip c) {
        return new ClipSummary(
                c.getId(),
                c.getNodeId(),
                c.getFilename(),
                c.getDisplayName(),
                c.getDurationSeconds(),
                c.getRecordedAt(),
                c.getStatus(),
                c.getWordCount(),
                TranscriptUtil.preview(c.getTranscriptText(), PREVIEW_CHARS),
                c.getErrorMessage(),
                c.isPrivacySuppressed()
        );
    }
}
