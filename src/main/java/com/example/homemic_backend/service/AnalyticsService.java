package com.example.homemic_backend.service;

import com.example.homemic_backend.dto.AnalyticsResponse;
import com.example.homemic_backend.model.Node;
import com.example.homemic_backend.model.Speaker;
import com.example.homemic_backend.repository.ClipRepository;
import com.example.homemic_backend.repository.NodeRepository;
import com.example.homemic_backend.repository.SpeakerRepository;
import com.example.homemic_backend.repository.TranscriptSegmentRepository;
import com.example.homemic_backend.util.ClipStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class AnalyticsService {
    public static final int MAX_PERIOD_HOURS = 24 * 30;
    private static final DateTimeFormatter HOUR = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:00").withZone(ZoneOffset.UTC);

    private final ClipRepository clipRepo;
    private final TranscriptSegmentRepository segmentRepo;
    private final NodeRepository nodeRepo;
    private final SpeakerRepository speakerRepo;
    private final Clock clock;

    public AnalyticsService(ClipRepository clipRepo,
                            TranscriptSegmentRepository segmentRepo,
                            NodeRepository nodeRepo,
                            SpeakerRepository speakerRepo,
                            Clock clock) {
        this.clipRepo = clipRepo;
        this.segmentRepo = segmentRepo;
        this.nodeRepo = nodeRepo;
        this.speakerRepo = speakerRepo;
        this.clock = clock;
    }

    /** Every node is listed, idle ones with zero totals. */
    @Transactional(readOnly = true)
    public AnalyticsResponse.Rooms rooms(int periodHours) {
        Instant since = since(periodHours);
        Map<String, ClipRepository.NodeActivity> byNode = clipRepo.activityByNode(ClipStatus.TRANSCRIBED, since).stream()
                .collect(Collectors.toMap(ClipRepository.NodeActivity::getNodeId, Function.identity()));
        List<AnalyticsResponse.Room> rooms = nodeRepo.findAll().stream()
                .sorted(Comparator.comparing(Node::getId))
                .map(n -> {
                    var a = byNode.get(n.getId());
                    long count = a == null ? 0 : a.getClipCount();
                    double seconds = a == null ? 0 : a.getTotalSeconds();
                    return new AnalyticsResponse.Room(n.getId(), n.getName(), n.getLocation(), count,
                            round1(seconds), round1(seconds / 60));
                })
                .toList();
        return new AnalyticsResponse.Rooms(periodHours, rooms);
    }

    @Transactional(readOnly = true)
    public AnalyticsResponse.Speakers speakers(int periodHours) {
        Instant since = since(periodHours);
        Map<UUID, TranscriptSegmentRepository.SpeakerActivity> bySpeaker = segmentRepo.activityBySpeaker(since).stream()
                .collect(Collectors.toMap(TranscriptSegmentRepository.SpeakerActivity::getSpeakerId, Function.identity()));
        List<AnalyticsResponse.Speaker> speakers = speakerRepo.findAllByOrderByNameAsc().stream()
                .map((Speaker s) -> {
                    var a = bySpeaker.get(s.getId());
                    double seconds = a == null ? 0 : a.getTotalSeconds();
                    return new AnalyticsResponse.Speaker(s.getId(), s.getName(), s.getColor(),
                            a == null ? 0 : a.getClipCount(),
                            a == null ? 0 : a.getSegmentCount(),
                            round1(seconds), round1(seconds / 60));
                })
                .toList();
        return new AnalyticsResponse.Speakers(periodHours, speakers, segmentRepo.countUnattributedSince(since));
    }

    /** Only hours with at least one transcript appear. */
    @Transactional(readOnly = true)
    public AnalyticsResponse.Hourly hourly(int periodHours) {
        Map<Instant, Long> buckets = new TreeMap<>();
        for (Instant recordedAt : clipRepo.recordedTimes(ClipStatus.TRANSCRIBED, since(periodHours))) {
            buckets.merge(recordedAt.truncatedTo(ChronoUnit.HOURS), 1L, Long::sum);
        }
        List<AnalyticsResponse.Hour> hours = buckets.entrySet().stream()
                .map(e -> new AnalyticsResponse.Hour(HOUR.format(e.getKey()), e.getValue()))
                .toList();
        long total = buckets.values().stream().mapToLong(Long::longValue).sum();
        return new AnalyticsResponse.Hourly(periodHours, hours, total);
    }

    private Instant since(int periodHours) {
        if (periodHours < 1 || periodHours > MAX_PERIOD_HOURS) {
            throw new IllegalArgumentException("period_hours must be between 1 and " + MAX_PERIOD_HOURS);
        }
        return clock.instant().minus(Duration.ofHours(periodHours));
    }

    private static double round1(double v) {
        return Math.round(v * 10) / 10.0;
    }
}
