package com.example.homemic_backend.service;

import com.example.homemic_backend.engine.Interfaces.Transcriber;
import com.example.homemic_backend.service.Interfaces.ClipStore.SegmentDraft;
import com.example.homemic_backend.util.TranscriptUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns raw engine output into storable segments: artefacts stripped, empty text dropped, times
 * clamped to {@code [0, duration]}, ordered by start and trimmed so consecutive segments never overlap.
 */
@Component
public class SegmentNormalizer {

    public List<SegmentDraft> normalize(List<Transcriber.Segment> raw, double durationSeconds) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        double duration = Math.max(0, durationSeconds);
        List<SegmentDraft> cleaned = new ArrayList<>(raw.size());
        for (Transcriber.Segment s : raw) {
            String text = TranscriptUtil.clean(s.text());
            if (text.isEmpty()) {
                continue;
            }
            double start = clamp(s.start(), 0, duration);
            double end = clamp(s.end(), start, duration);
            cleaned.add(new SegmentDraft(start, end, text, clamp(s.confidence(), 0, 1)));
        }
        cleaned.sort(Comparator.comparingDouble(SegmentDraft::startTime).thenComparingDouble(SegmentDraft::endTime));

        List<SegmentDraft> out = new ArrayList<>(cleaned.size());
        double cursor = 0;
        for (SegmentDraft s : cleaned) {
            double start = Math.max(s.startTime(), cursor);
            double end = Math.max(s.endTime(), start);
            out.add(new SegmentDraft(start, end, s.text(), s.confidence()));
            cursor = end;
        }
        return out;
    }

    public static String joinText(List<SegmentDraft> segments) {
        StringBuilder sb = new StringBuilder();
        for (SegmentDraft s : segments) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(s.text());
        }
        return sb.toString();
    }

    private static double clamp(double v, double min, double max) {
        if (Double.isNaN(v)) return min;
        return Math.max(min, Math.min(max, v));
    }
}
