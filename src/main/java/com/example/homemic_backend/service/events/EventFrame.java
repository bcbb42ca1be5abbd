package com.example.homemic_backend.service.events;

/**
 * Wire envelope: {@code {"type": ..., "data": ...}}.
 */
public record EventFrame(String type, Object data) {
}
