package com.example.homemic_backend.service.events;

/**
 * Closed set of events delivered to live subscribers. {@link #type()} is the wire tag of the frame.
 */
public sealed interface PipelineEvent
        permits InitialStateEvent, TranscriptionEvent, NodeStatusEvent, KeywordDetectedEvent,
                AudioLevelEvent, ClipFailedEvent {

    String type();
}
