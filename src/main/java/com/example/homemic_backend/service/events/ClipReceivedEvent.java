package com.example.homemic_backend.service.events;

import java.util.UUID;

/**
 * In-process notification that an admitted clip is ready to be claimed. Not sent to live subscribers.
 */
public record ClipReceivedEvent(UUID clipId, String nodeId) {
}
