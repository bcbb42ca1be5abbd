package com.example.homemic_backend.service.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Encodes pipeline events to JSON frames and decodes them back into the closed event set.
 * Unknown frame types are rejected rather than passed through as loose maps.
 */
@Component
public class EventFrameCodec {
    public static final String PING = "ping";
    public static final String PONG = "pong";

    private static final Map<String, Class<? extends PipelineEvent>> TYPES = Map.of(
            InitialStateEvent.TYPE, InitialStateEvent.class,
            TranscriptionEvent.TYPE, TranscriptionEvent.class,
            NodeStatusEvent.TYPE, NodeStatusEvent.class,
            KeywordDetectedEvent.TYPE, KeywordDetectedEvent.class,
            AudioLevelEvent.TYPE, AudioLevelEvent.class,
            ClipFailedEvent.TYPE, ClipFailedEvent.class
    );

    private final ObjectMapper mapper;

    public EventFrameCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(PipelineEvent event) {
        return write(new EventFrame(event.type(), event));
    }

    public String ping(Instant at) {
        return write(new EventFrame(PING, Map.of("ts", at.toString())));
    }

    public String pong(Instant at) {
        return write(new EventFrame(PONG, Map.of("ts", at.toString())));
    }

    public PipelineEvent decode(String json) {
        JsonNode root = readTree(json);
        String type = root.path("type").asText("");
        Class<? extends PipelineEvent> target = TYPES.get(type);
        if (target == null) {
            throw new IllegalArgumentException("Unknown event frame type: " + type);
        }
        try {
            return mapper.treeToValue(root.path("data"), target);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + type + " frame", e);
        }
    }

    /**
     * Returns the {@code type} tag of an inbound frame, or {@code null} if it is not a JSON object.
     */
    public String typeOf(String json) {
        try {
            JsonNode root = mapper.readTree(json);
            return root != null && root.isObject() ? root.path("type").asText(null) : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private String write(EventFrame frame) {
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + frame.type() + " frame", e);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Frame is not valid JSON", e);
        }
    }
}
