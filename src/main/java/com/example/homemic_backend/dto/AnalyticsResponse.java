package com.example.homemic_backend.dto;

import java.util.List;
import java.util.UUID;

/**
 * Activity summaries over the last {@code periodHours}. Only transcribed clips are counted,
 * bucketed by recording time.
 */
public final class AnalyticsResponse {

    private AnalyticsResponse() {}

    public record Rooms(int periodHours, List<Room> rooms) {}

    public record Room(String nodeId, String name, String location, long transcriptionCount,
                       double totalDurationSeconds, double totalDurationMinutes) {}

    public record Speakers(int periodHours, List<Speaker> speakers, long unattributedSegments) {}

    public record Speaker(UUID speakerId, String name, String color, long clipCount, long segmentCount,
                          double totalDurationSeconds, double totalDurationMinutes) {}

    public record Hourly(int periodHours, List<Hour> hourly, long total) {}

    /** {@code hour} is {@code yyyy-MM-dd HH:00} in UTC. */
    public record Hour(String hour, long count) {}
}
