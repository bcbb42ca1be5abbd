package com.example.homemic_backend.exception;

/**
 * The speech-to-text engine could not produce a transcript. Recorded on the clip and retried
 * by the coordinator up to the configured attempt limit.
 */
public class TranscriptionException extends HomeMicException {

    private final String engine;

    public TranscriptionException(String engine, String message) {
        super(message);
        this.engine = engine;
    }

    public TranscriptionException(String engine, String message, Throwable cause) {
        super(message, cause);
        this.engine = engine;
    }

    public String getEngine() {
        return engine;
    }
}
