package com.example.homemic_backend.engine.Interfaces;

import java.util.List;
import java.util.UUID;

/**
 * Speech-to-text capability: audio bytes in, timed segments out. Implementations are stateless
 * from the pipeline's point of view and may be called concurrently for different clips.
 */
public interface Transcriber {
    record Request(UUID clipId, byte[] audio, String filename, double durationSeconds) {}
    record Segment(double start, double end, String text, double confidence) {}
    record Result(List<Segment> segments, String language, String provider) {}

    /**
     * @throws com.example.homemic_backend.exception.TranscriptionException when no transcript could be produced
     */
    Result transcribe(Request request);
}
