package com.example.homemic_backend.engine;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.homemic_backend.config.TranscriberProperties;
import com.example.homemic_backend.engine.Interfaces.Transcriber;
import com.example.homemic_backend.exception.TranscriptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WhisperHttpTranscriberTest {

    private static final ExchangeStrategies STRATEGIES = ExchangeStrategies.withDefaults();

    private TranscriberProperties props;
    private Transcriber.Request request;

    @BeforeEach
    void setUp() {
        props = new TranscriberProperties();
        props.setTimeoutSeconds(5);
        request = new Transcriber.Request(UUID.randomUUID(), new byte[]{1, 2, 3}, "kitchen.wav", 12.0);
    }

    @Test
    void parsesVerboseJsonSegments() {
        AtomicReference<String> body = new AtomicReference<>();
        ExchangeFunction exchange = req -> {
            body.set(bodyOf(req));
            return Mono.just(json(HttpStatus.OK, """
                    {"text":"hi there","language":"EN","segments":[
                      {"start":0.0,"end":1.5,"text":" hi","avg_logprob":-0.5},
                      {"start":1.5,"end":3.0,"text":" there"}]}
                    """));
        };

        Transcriber.Result result = transcriber(exchange).transcribe(request);

        assertThat(result.language()).isEqualTo("en");
        assertThat(result.provider()).isEqualTo("whisper");
        assertThat(result.segments()).hasSize(2);
        assertThat(result.segments().get(0).confidence()).isCloseTo(0.9, within(1e-9));
        assertThat(result.segments().get(1).confidence()).isEqualTo(WhisperHttpTranscriber.DEFAULT_CONFIDENCE);
        assertThat(body.get()).contains("verbose_json").contains(props.getModel()).contains("kitchen.wav");
    }

    @Test
    void plainTextResponseBecomesOneSegmentSpanningTheClip() {
        ExchangeFunction exchange = req -> Mono.just(json(HttpStatus.OK, "{\"text\":\"hello\"}"));

        Transcriber.Result result = transcriber(exchange).transcribe(request);

        assertThat(result.language()).isEqualTo("auto");
        assertThat(result.segments()).singleElement().satisfies(s -> {
            assertThat(s.start()).isZero();
            assertThat(s.end()).isEqualTo(12.0);
            assertThat(s.text()).isEqualTo("hello");
        });
    }

    @Test
    void retriesOnConnectionReset() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = req -> {
            if (attempts.incrementAndGet() < 3) {
                return Mono.error(new WebClientRequestException(
                        new IOException("Connection reset by peer"), req.method(), req.url(), req.headers()));
            }
            return Mono.just(json(HttpStatus.OK, "{\"text\":\"ok\",\"language\":\"en\",\"segments\":[]}"));
        };

        Logger logger = (Logger) LoggerFactory.getLogger(WhisperHttpTranscriber.class);
        ListAppender<ILoggingEvent> listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);
        try {
            Transcriber.Result result = transcriber(exchange).transcribe(request);

            assertThat(attempts.get()).isEqualTo(3);
            assertThat(result.segments()).isEmpty();
            List<String> warnings = listAppender.list.stream()
                    .filter(event -> event.getLevel() == Level.WARN)
                    .map(ILoggingEvent::getFormattedMessage)
                    .toList();
            assertThat(warnings).hasSize(2).allMatch(m -> m.contains("ASR retry") && m.contains(request.clipId().toString()));
        } finally {
            logger.detachAppender(listAppender);
            listAppender.stop();
        }
    }

    @Test
    void serverErrorIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = req -> {
            attempts.incrementAndGet();
            return Mono.just(json(HttpStatus.BAD_GATEWAY, "{\"error\":\"model loading\"}"));
        };

        assertThatThrownBy(() -> transcriber(exchange).transcribe(request))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("502")
                .hasMessageContaining("model loading");
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void malformedJsonIsReportedAsTranscriptionFailure() {
        ExchangeFunction exchange = req -> Mono.just(json(HttpStatus.OK, "not json"));

        assertThatThrownBy(() -> transcriber(exchange).transcribe(request))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Invalid ASR JSON");
    }

    @Test
    void emptyAudioFailsWithoutCallingTheServer() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = req -> {
            attempts.incrementAndGet();
            return Mono.empty();
        };

        assertThatThrownBy(() -> transcriber(exchange).transcribe(
                new Transcriber.Request(UUID.randomUUID(), new byte[0], "a.wav", 1.0)))
                .isInstanceOf(TranscriptionException.class);
        assertThat(attempts.get()).isZero();
    }

    @Test
    void logprobMapsIntoUnitInterval() {
        assertThat(WhisperHttpTranscriber.confidenceFromLogprob(0)).isEqualTo(1.0);
        assertThat(WhisperHttpTranscriber.confidenceFromLogprob(-10)).isEqualTo(0.0);
        assertThat(WhisperHttpTranscriber.confidenceFromLogprob(-2.5)).isCloseTo(0.5, within(1e-9));
    }

    private WhisperHttpTranscriber transcriber(ExchangeFunction exchange) {
        WebClient client = WebClient.builder().exchangeFunction(exchange).build();
        return new WhisperHttpTranscriber(client, props);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private static String bodyOf(ClientRequest request) {
        MockClientHttpRequest mockRequest = new MockClientHttpRequest(request.method(), request.url());
        request.body().insert(mockRequest, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return STRATEGIES.messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return mockRequest.getBodyAsString().block();
    }
}
