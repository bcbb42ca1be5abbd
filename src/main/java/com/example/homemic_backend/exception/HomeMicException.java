package com.example.homemic_backend.exception;

/**
 * Base type for domain errors raised by the ingestion and transcription pipeline.
 * {@link com.example.homemic_backend.controller.GlobalExceptionHandler} maps subclasses to HTTP responses.
 */
public class HomeMicException extends RuntimeException {

    public HomeMicException(String message) {
        super(message);
    }

    public HomeMicException(String message, Throwable cause) {
        super(message, cause);
    }
}
