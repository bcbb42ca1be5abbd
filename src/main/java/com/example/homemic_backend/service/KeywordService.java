package com.example.homemic_backend.service;

import com.example.homemic_backend.exception.NotFoundException;
import com.example.homemic_backend.model.Keyword;
import com.example.homemic_backend.model.KeywordDetection;
import com.example.homemic_backend.repository.ClipRepository;
import com.example.homemic_backend.repository.KeywordDetectionRepository;
import com.example.homemic_backend.repository.KeywordRepository;
import com.example.homemic_backend.service.events.KeywordDetectedEvent;
import com.example.homemic_backend.util.KeywordPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class KeywordService {
    private static final Logger LOGGER = LoggerFactory.getLogger(KeywordService.class);
    private static final int SNIPPET_CONTEXT = 40;

    private final KeywordRepository keywordRepo;
    private final KeywordDetectionRepository detectionRepo;
    private final ClipRepository clipRepo;
    private final Clock clock;

    public KeywordService(KeywordRepository keywordRepo,
                          KeywordDetectionRepository detectionRepo,
                          ClipRepository clipRepo,
                          Clock clock) {
        this.keywordRepo = keywordRepo;
        this.detectionRepo = detectionRepo;
        this.clipRepo = clipRepo;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<Keyword> list() {
        return keywordRepo.findAllByOrderByCreatedAtDesc();
    }

    @Transactional
    public Keyword create(String phrase, String category, KeywordPriority priority, boolean caseSensitive) {
        if (phrase == null || phrase.isBlank()) {
            throw new IllegalArgumentException("phrase is required");
        }
        Keyword keyword = keywordRepo.save(new Keyword(phrase.trim(), category, priority, caseSensitive));
        LOGGER.info("Keyword created id={} phrase='{}' priority={}", keyword.getId(), keyword.getPhrase(), keyword.getPriority());
        return keyword;
    }

    @Transactional
    public Keyword setEnabled(UUID id, boolean enabled) {
        Keyword keyword = require(id);
        keyword.setEnabled(enabled);
        return keywordRepo.save(keyword);
    }

    @Transactional
    public void delete(UUID id) {
        Keyword keyword = require(id);
        detectionRepo.deleteByKeywordId(keyword.getId());
        keywordRepo.deleteById(keyword.getId());
    }

    @Transactional
    public Keyword reset(UUID id) {
        require(id);
        keywordRepo.resetCount(id);
        return require(id);
    }

    @Transactional(readOnly = true)
    public List<KeywordDetection> detections(UUID id, int limit) {
        require(id);
        return detectionRepo.findByKeywordIdOrderByDetectedAtDesc(id, PageRequest.of(0, Math.max(1, Math.min(limit, 500))));
    }

    /**
     * Matches every enabled keyword against a finished transcript. Each keyword counts at most once
     * per clip, so re-running on the same clip changes nothing.
     *
     * @return one event per newly recorded detection, in keyword order
     */
    @Transactional
    public List<KeywordDetectedEvent> recordMatches(UUID clipId, String nodeId, String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return List.of();
        }
        Instant now = clock.instant();
        List<KeywordDetectedEvent> events = new ArrayList<>();
        for (Keyword keyword : keywordRepo.findByEnabledTrue()) {
            Matcher m = patternFor(keyword).matcher(transcript);
            if (!m.find()) {
                continue;
            }
            if (detectionRepo.existsByKeywordIdAndClipId(keyword.getId(), clipId)) {
                continue;
            }
            if (keywordRepo.recordDetection(keyword.getId(), now) == 0) {
                // disabled between the read and the increment
                continue;
            }
            String snippet = snippet(transcript, m.start(), m.end());
            detectionRepo.save(new KeywordDetection(keywordRepo.getReferenceById(keyword.getId()),
                    clipRepo.getReferenceById(clipId), snippet, now));
            LOGGER.info("KEYWORD detected phrase='{}' clipId={} node={}", keyword.getPhrase(), clipId, nodeId);
            events.add(new KeywordDetectedEvent(keyword.getId(), keyword.getPhrase(), keyword.getCategory(),
                    keyword.getPriority(), clipId, nodeId, snippet, now));
        }
        return events;
    }

    static Pattern patternFor(Keyword keyword) {
        String body = "(?<![\\p{L}\\p{N}])" + Pattern.quote(keyword.getPhrase().trim()) + "(?![\\p{L}\\p{N}])";
        int flags = keyword.isCaseSensitive() ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        return Pattern.compile(body, flags);
    }

    private static String snippet(String text, int start, int end) {
        int from = Math.max(0, start - SNIPPET_CONTEXT);
        int to = Math.min(text.length(), end + SNIPPET_CONTEXT);
        String s = text.substring(from, to).trim();
        if (from > 0) s = "..." + s;
        if (to < text.length()) s = s + "...";
        return s;
    }

    private Keyword require(UUID id) {
        return keywordRepo.findById(id).orElseThrow(() -> new NotFoundException("Keyword", id));
    }
}
