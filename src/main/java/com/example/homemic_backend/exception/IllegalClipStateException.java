package com.example.homemic_backend.exception;

import com.example.homemic_backend.util.ClipStatus;

import java.util.UUID;

public class IllegalClipStateException extends HomeMicException {

    private final UUID clipId;
    private final ClipStatus status;

    public IllegalClipStateException(UUID clipId, ClipStatus status, String message) {
        super(message);
        this.clipId = clipId;
        this.status = status;
    }

    public UUID getClipId() {
        return clipId;
    }

    public ClipStatus getStatus() {
        return status;
    }
}
