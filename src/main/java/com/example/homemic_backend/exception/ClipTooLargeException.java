package com.example.homemic_backend.exception;

public class ClipTooLargeException extends HomeMicException {

    private final long maxBytes;

    public ClipTooLargeException(long maxBytes) {
        super("Audio exceeds maximum size of " + (maxBytes / 1024 / 1024) + "MB");
        this.maxBytes = maxBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }
}
