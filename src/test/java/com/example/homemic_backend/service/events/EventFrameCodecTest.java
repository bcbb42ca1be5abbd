package com.example.homemic_backend.service.events;

import com.example.homemic_backend.util.KeywordPriority;
import com.example.homemic_backend.util.NodeStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventFrameCodecTest {

    private final ObjectMapper mapper = TestMappers.snakeCase();
    private final EventFrameCodec codec = new EventFrameCodec(mapper);
    private final Instant now = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void transcriptionFrameCarriesTypeAndSnakeCaseData() throws Exception {
        UUID clipId = UUID.randomUUID();
        String frame = codec.encode(new TranscriptionEvent(clipId, "kitchen", "hello", 1, 1, 2.5, now, now));

        JsonNode root = mapper.readTree(frame);
        assertThat(root.path("type").asText()).isEqualTo("transcription");
        assertThat(root.path("data").path("clip_id").asText()).isEqualTo(clipId.toString());
        assertThat(root.path("data").path("word_count").asInt()).isEqualTo(1);
    }

    @Test
    void decodesKnownFrameTypes() {
        var original = new KeywordDetectedEvent(UUID.randomUUID(), "fire", "safety", KeywordPriority.HIGH,
                UUID.randomUUID(), "kitchen", "there is a fire", now);

        PipelineEvent decoded = codec.decode(codec.encode(original));

        assertThat(decoded).isEqualTo(original);
    }

    @Test
    void initialStateRoundTripsNestedLists() {
        var node = new NodeStatusEvent("kitchen", "Kitchen", "Ground floor", NodeStatus.ONLINE, NodeStatus.OFFLINE, now, 12.0);
        var original = new InitialStateEvent(List.of(), List.of(node), now);

        assertThat(codec.decode(codec.encode(original))).isEqualTo(original);
    }

    @Test
    void unknownTypeIsRejected() {
        assertThatThrownBy(() -> codec.decode("{\"type\":\"mystery\",\"data\":{}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mystery");
    }

    @Test
    void typeOfToleratesGarbage() {
        assertThat(codec.typeOf(codec.ping(now))).isEqualTo(EventFrameCodec.PING);
        assertThat(codec.typeOf("{\"type\":\"pong\"}")).isEqualTo(EventFrameCodec.PONG);
        assertThat(codec.typeOf("not json")).isNull();
        assertThat(codec.typeOf("[1,2]")).isNull();
    }
}
