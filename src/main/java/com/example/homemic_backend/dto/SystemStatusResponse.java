package com.example.homemic_backend.dto;

import java.time.Instant;

public record SystemStatusResponse(
        long uptimeSeconds,
        int totalNodes,
        int activeNodes,
        long enrolledSpeakers,
        ClipCounts clips,
        Double averageProcessingMs,
        Disk disk,
        long memoryUsedBytes,
        long memoryMaxBytes,
        int liveSubscribers,
        Instant timestamp
) {
    public record ClipCounts(long pending, long processing, long transcribed, long failed) {}

    /** Volume holding the audio root; {@code usedPercent} is rounded to one decimal. */
    public record Disk(long totalBytes, long usableBytes, long usedBytes, double usedPercent) {}
}
