package com.example.homemic_backend.engine;

import com.example.homemic_backend.engine.Interfaces.Transcriber;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic stand-in for local development without a speech-to-text server.
 */
public class DummyTranscriber implements Transcriber {
    private static final double SEGMENT_SECONDS = 5.0;
    private static final List<String> LINES = List.of(
            "This is a placeholder transcript.",
            "The speech engine is not configured.",
            "Set homemic.transcriber.provider to whisper to use a real engine."
    );

    @Override
    public Result transcribe(Request request) {
        double duration = Math.max(0, request.durationSeconds());
        List<Segment> segments = new ArrayList<>();
        int i = 0;
        for (double start = 0; start < duration && i < LINES.size(); start += SEGMENT_SECONDS, i++) {
            double end = Math.min(duration, start + SEGMENT_SECONDS);
            segments.add(new Segment(start, end, LINES.get(i), 0.9));
        }
        return new Result(segments, "en", "dummy");
    }
}
