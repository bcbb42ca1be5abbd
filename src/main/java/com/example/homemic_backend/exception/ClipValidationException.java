package com.example.homemic_backend.exception;

/**
 * Upload rejected before any state was created.
 */
public class ClipValidationException extends HomeMicException {

    private final String field;

    public ClipValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
