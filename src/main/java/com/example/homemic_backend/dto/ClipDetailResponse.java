package com.example.homemic_backend.dto;

import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.model.TranscriptSegment;
import com.example.homemic_backend.util.ClipStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ClipDetailResponse(
        UUID id,
        String nodeId,
        String filename,
        String displayName,
        String notes,
        long fileSize,
        double durationSeconds,
        Instant recordedAt,
        Instant uploadedAt,
        Instant processedAt,
        ClipStatus status,
        String errorMessage,
        Long processingDurationMs,
        int attempts,
        boolean privacySuppressed,
        boolean audioAvailable,
        String transcriptText,
        int wordCount,
        List<SegmentResponse> segments
) {
    public static ClipDetailResponse from(Clip c, List<TranscriptSegment> segments) {
        return new ClipDetailResponse(
                c.getId(),
                c.getNodeId(),
                c.getFilename(),
                c.getDisplayName(),
                c.getNotes(),
                c.getFileSize(),
                c.getDurationSeconds(),
                c.getRecordedAt(),
                c.getUploadedAt(),
                c.getProcessedAt(),
                c.getStatus(),
                c.getErrorMessage(),
                c.getProcessingDurationMs(),
                c.getAttempts(),
                c.isPrivacySuppressed(),
                !c.isAudioDeleted() && c.getObjectKey() != null,
                c.getTranscriptText(),
                c.getWordCount(),
                segments.stream().map(SegmentResponse::from).toList()
        );
    }
}
