package com.example.homemic_backend.engine;

import com.example.homemic_backend.config.TranscriberProperties;
import com.example.homemic_backend.engine.Interfaces.Transcriber;
import com.example.homemic_backend.exception.TranscriptionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Calls an OpenAI-compatible {@code /v1/audio/transcriptions} endpoint (faster-whisper-server,
 * whisper.cpp server, OpenAI) with {@code response_format=verbose_json}.
 */
public class WhisperHttpTranscriber implements Transcriber {
    private static final Logger LOGGER = LoggerFactory.getLogger(WhisperHttpTranscriber.class);
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(200);
    private static final int RETRY_MAX_ATTEMPTS = 2;
    static final double DEFAULT_CONFIDENCE = 0.8;
    static final String PROVIDER = "whisper";

    private final WebClient client;
    private final TranscriberProperties props;
    private final ObjectMapper om = new ObjectMapper();

    public WhisperHttpTranscriber(WebClient client, TranscriberProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public Result transcribe(Request request) {
        if (request.audio() == null || request.audio().length == 0) {
            throw new TranscriptionException(PROVIDER, "empty audio for clip " + request.clipId());
        }
        var form = new LinkedMultiValueMap<String, Object>();
        form.add("file", new NamedByteArrayResource(request.audio(), request.filename()));
        form.add("model", props.getModel());
        form.add("response_format", "verbose_json");
        if (props.getLanguage() != null && !props.getLanguage().isBlank()) {
            form.add("language", props.getLanguage().toLowerCase(Locale.ROOT));
        }

        Mono<JsonNode> mono = client.post()
                .uri("/v1/audio/transcriptions")
                .body(BodyInserters.fromMultipartData(form))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> new TranscriptionException(PROVIDER,
                                        "ASR error %s: %s".formatted(resp.statusCode(), truncate(body, 500)))))
                .bodyToMono(String.class)
                .map(this::parseJson)
                .retryWhen(Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn(
                                "ASR retry attempt={} clipId={} type={}",
                                signal.totalRetriesInARow() + 1,
                                request.clipId(),
                                signal.failure() == null ? "unknown" : signal.failure().getClass().getSimpleName())));

        JsonNode root;
        try {
            root = mono.block(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));
        } catch (TranscriptionException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = unwrapRetryExhausted(e);
            if (cause instanceof TranscriptionException te) {
                throw te;
            }
            throw new TranscriptionException(PROVIDER, "ASR request failed: " + cause, cause);
        }
        if (root == null) {
            throw new TranscriptionException(PROVIDER, "Empty response from ASR");
        }

        List<Segment> segments = new ArrayList<>();
        JsonNode segs = root.get("segments");
        if (segs != null && segs.isArray()) {
            for (JsonNode seg : segs) {
                String text = seg.path("text").asText("");
                double start = seg.path("start").asDouble(0);
                double end = seg.path("end").asDouble(start);
                double confidence = seg.has("avg_logprob")
                        ? confidenceFromLogprob(seg.get("avg_logprob").asDouble())
                        : DEFAULT_CONFIDENCE;
                segments.add(new Segment(start, end, text, confidence));
            }
        } else {
            // Plain text response: one segment spanning the clip.
            String text = root.path("text").asText("");
            if (!text.isBlank()) {
                segments.add(new Segment(0, Math.max(0, request.durationSeconds()), text, DEFAULT_CONFIDENCE));
            }
        }
        String lang = root.path("language").asText("");
        if (lang.isBlank()) lang = "auto";
        LOGGER.debug("ASR parsed clipId={} segments={} lang={}", request.clipId(), segments.size(), lang);
        return new Result(segments, lang.toLowerCase(Locale.ROOT), PROVIDER);
    }

    static double confidenceFromLogprob(double avgLogprob) {
        return Math.max(0.0, Math.min(1.0, 1.0 + avgLogprob / 5.0));
    }

    private JsonNode parseJson(String body) {
        try {
            return om.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new TranscriptionException(PROVIDER, "Invalid ASR JSON: " + truncate(body, 200), e);
        }
    }

    private boolean isRetryable(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (cursor instanceof PrematureCloseException || cursor instanceof WebClientRequestException) {
                return true;
            }
            cursor = cursor.getCause();
        }
        return false;
    }

    private Throwable unwrapRetryExhausted(Throwable t) {
        if (Exceptions.isRetryExhausted(t) && t.getCause() != null) {
            return t.getCause();
        }
        return t;
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    private static final class NamedByteArrayResource extends ByteArrayResource {
        private final String filename;

        NamedByteArrayResource(byte[] bytes, String filename) {
            super(bytes);
            this.filename = filename == null || filename.isBlank() ? "clip.wav" : filename;
        }

        @Override
        public String getFilename() {
            return filename;
        }
    }
}
