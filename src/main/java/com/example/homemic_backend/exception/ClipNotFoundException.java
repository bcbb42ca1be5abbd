package com.example.homemic_backend.exception;

import java.util.UUID;

public class ClipNotFoundException extends NotFoundException {

    public ClipNotFoundException(UUID clipId) {
        super("Clip", clipId);
    }
}
