package com.example.homemic_backend.dto;

import com.example.homemic_backend.model.TranscriptSegment;

import java.util.UUID;

public record SegmentResponse(
        UUID id,
        double startTime,
        double endTime,
        String text,
        double confidence,
        UUID speakerId,
        String speakerName
) {
    public static SegmentResponse from(TranscriptSegment s) {
        var speaker = s.getSpeaker();
        return new SegmentResponse(
                s.getId(),
                s.getStartTime(),
                s.getEndTime(),
                s.getText(),
                s.getConfidence(),
                speaker != null ? speaker.getId() : null,
                speaker != null ? speaker.getName() : null
        );
    }
}
