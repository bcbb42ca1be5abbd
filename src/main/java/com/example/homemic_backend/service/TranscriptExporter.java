package com.example.homemic_backend.service;

import com.example.homemic_backend.dto.ClipDetailResponse;
import com.example.homemic_backend.dto.SegmentResponse;
import com.example.homemic_backend.util.ExportFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders transcripts as plain text, SubRip or JSON documents.
 */
@Component
public class TranscriptExporter {

    public record ExportDocument(String filename, ExportFormat format, String body) {}

    private final ObjectMapper objectMapper;

    public TranscriptExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExportDocument export(ClipDetailResponse clip, ExportFormat format) {
        String body = switch (format) {
            case TXT -> buildTxt(clip);
            case SRT -> buildSrt(clip.segments());
            case JSON -> toJson(clip);
        };
        return new ExportDocument(baseName(clip) + "." + format.extension(), format, body);
    }

    /**
     * JSON yields one array of clip documents; TXT concatenates per-clip blocks under a header line.
     */
    public ExportDocument exportAll(List<ClipDetailResponse> clips, ExportFormat format) {
        String body = switch (format) {
            case JSON -> toJson(clips);
            case TXT -> {
                StringBuilder out = new StringBuilder();
                for (ClipDetailResponse clip : clips) {
                    if (out.length() > 0) {
                        out.append('\n');
                    }
                    out.append("=== ").append(baseName(clip)).append(" | ").append(clip.nodeId())
                            .append(" | ").append(clip.recordedAt()).append(" ===\n");
                    out.append(buildTxt(clip));
                }
                yield out.toString();
            }
            case SRT -> throw new IllegalArgumentException("bulk export supports txt or json");
        };
        return new ExportDocument("transcripts." + format.extension(), format, body);
    }

    static String buildTxt(ClipDetailResponse clip) {
        List<SegmentResponse> segments = clip.segments();
        if (segments.isEmpty()) {
            String text = clip.transcriptText();
            return text == null || text.isBlank() ? "" : text + "\n";
        }
        StringBuilder out = new StringBuilder();
        for (SegmentResponse s : segments) {
            out.append('[').append(formatClock(s.startTime())).append("] ");
            if (s.speakerName() != null) {
                out.append(s.speakerName()).append(": ");
            }
            out.append(s.text()).append('\n');
        }
        return out.toString();
    }

    static String buildSrt(List<SegmentResponse> segments) {
        StringBuilder srt = new StringBuilder();
        int index = 1;
        for (SegmentResponse s : segments) {
            srt.append(index++).append('\n');
            srt.append(formatSrtTime(toMillis(s.startTime())))
               .append(" --> ")
               .append(formatSrtTime(toMillis(s.endTime())))
               .append('\n');
            srt.append(s.text()).append("\n\n");
        }
        return srt.toString();
    }

    static String formatClock(double seconds) {
        long total = (long) Math.max(0, Math.floor(seconds));
        return String.format("%02d:%02d", total / 60, total % 60);
    }

    static String formatSrtTime(long offsetMs) {
        long safeMs = Math.max(0, offsetMs);
        long hours = safeMs / 3_600_000;
        long minutes = (safeMs % 3_600_000) / 60_000;
        long seconds = (safeMs % 60_000) / 1000;
        long millis = safeMs % 1000;
        return String.format("%02d:%02d:%02d,%03d", hours, minutes, seconds, millis);
    }

    private static long toMillis(double seconds) {
        return Math.round(seconds * 1000.0);
    }

    private static String baseName(ClipDetailResponse clip) {
        String name = clip.displayName() != null && !clip.displayName().isBlank() ? clip.displayName() : clip.filename();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return stem.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise transcript export", e);
        }
    }
}
