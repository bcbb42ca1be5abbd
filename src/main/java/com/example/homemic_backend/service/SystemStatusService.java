package com.example.homemic_backend.service;

import com.example.homemic_backend.config.StorageProperties;
import com.example.homemic_backend.dto.SystemStatusResponse;
import com.example.homemic_backend.model.Node;
import com.example.homemic_backend.repository.ClipRepository;
import com.example.homemic_backend.repository.NodeRepository;
import com.example.homemic_backend.repository.SpeakerRepository;
import com.example.homemic_backend.service.events.EventBus;
import com.example.homemic_backend.util.ClipStatus;
import com.example.homemic_backend.util.NodeStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Dashboard summary behind {@code GET /api/status}: node and speaker counts, queue depth,
 * recent processing time and the state of the audio volume.
 */
@Service
public class SystemStatusService {
    static final Duration LATENCY_WINDOW = Duration.ofHours(1);

    private final NodeRepository nodeRepo;
    private final SpeakerRepository speakerRepo;
    private final ClipRepository clipRepo;
    private final NodeHealthMonitor health;
    private final EventBus events;
    private final StorageProperties storage;
    private final Clock clock;

    public SystemStatusService(NodeRepository nodeRepo,
                               SpeakerRepository speakerRepo,
                               ClipRepository clipRepo,
                               NodeHealthMonitor health,
                               EventBus events,
                               StorageProperties storage,
                               Clock clock) {
        this.nodeRepo = nodeRepo;
        this.speakerRepo = speakerRepo;
        this.clipRepo = clipRepo;
        this.health = health;
        this.events = events;
        this.storage = storage;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public SystemStatusResponse status() {
        Instant now = clock.instant();
        List<Node> nodes = nodeRepo.findAll();
        int active = (int) nodes.stream().filter(n -> health.currentStatus(n) != NodeStatus.OFFLINE).count();

        var clips = new SystemStatusResponse.ClipCounts(
                clipRepo.countByStatus(ClipStatus.PENDING),
                clipRepo.countByStatus(ClipStatus.PROCESSING),
                clipRepo.countByStatus(ClipStatus.TRANSCRIBED),
                clipRepo.countByStatus(ClipStatus.FAILED));

        Runtime runtime = Runtime.getRuntime();
        return new SystemStatusResponse(
                ManagementFactory.getRuntimeMXBean().getUptime() / 1000,
                nodes.size(),
                active,
                speakerRepo.count(),
                clips,
                clipRepo.averageProcessingMs(ClipStatus.TRANSCRIBED, now.minus(LATENCY_WINDOW)),
                disk(),
                runtime.totalMemory() - runtime.freeMemory(),
                runtime.maxMemory(),
                events.subscriberCount(),
                now);
    }

    SystemStatusResponse.Disk disk() {
        File root = Paths.get(storage.getBaseDir()).toAbsolutePath().toFile();
        long total = root.getTotalSpace();
        long usable = root.getUsableSpace();
        long used = Math.max(0, total - usable);
        double percent = total == 0 ? 0 : Math.round(used * 1000.0 / total) / 10.0;
        return new SystemStatusResponse.Disk(total, usable, used, percent);
    }
}
