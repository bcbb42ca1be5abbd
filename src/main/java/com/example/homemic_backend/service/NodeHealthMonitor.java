package com.example.homemic_backend.service;

import com.example.homemic_backend.model.Node;
import com.example.homemic_backend.repository.NodeRepository;
import com.example.homemic_backend.service.events.EventBus;
import com.example.homemic_backend.service.events.NodeStatusEvent;
import com.example.homemic_backend.util.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks last contact and latency per node. Updates for one node are serialised so that a
 * heartbeat and an upload arriving together cannot lose each other's write. A
 * {@code node_status} event goes out only when the derived status changes.
 */
@Service
public class NodeHealthMonitor {
    private static final Logger LOGGER = LoggerFactory.getLogger(NodeHealthMonitor.class);

    private final Map<String, Object> locks = new ConcurrentHashMap<>();
    private final NodeRepository nodeRepo;
    private final NodeStatusPolicy policy;
    private final EventBus events;
    private final TransactionTemplate tx;
    private final Clock clock;

    public NodeHealthMonitor(NodeRepository nodeRepo,
                             NodeStatusPolicy policy,
                             EventBus events,
                             PlatformTransactionManager txManager,
                             Clock clock) {
        this.nodeRepo = nodeRepo;
        this.policy = policy;
        this.events = events;
        this.tx = new TransactionTemplate(txManager);
        this.clock = clock;
    }

    private record Transition(Node node, NodeStatus previous) {}

    /**
     * Records a heartbeat or upload from a node, registering it on first contact.
     *
     * @param latencyMs round-trip sample, or {@code null} when the contact carried none
     */
    public Node recordContact(String nodeId, Double latencyMs, String ipAddress) {
        Transition t;
        synchronized (lockFor(nodeId)) {
            t = tx.execute(status -> {
                Instant now = clock.instant();
                Node node = nodeRepo.findById(nodeId).orElse(null);
                if (node == null) {
                    node = Node.register(nodeId);
                    LOGGER.info("NODE registered id={}", nodeId);
                }
                NodeStatus previous = node.getStatus();
                node.touch(now, latencyMs);
                if (ipAddress != null && !ipAddress.isBlank()) {
                    node.setIpAddress(ipAddress);
                }
                node.setStatus(policy.evaluate(node, now));
                return new Transition(nodeRepo.save(node), previous);
            });
        }
        publishIfChanged(t);
        return t.node();
    }

    /** Status as of now, without writing anything. */
    public NodeStatus currentStatus(Node node) {
        return policy.evaluate(node, clock.instant());
    }

    /**
     * Catches nodes that went quiet: nothing else would notice their status change.
     */
    @Scheduled(fixedDelayString = "${homemic.health.sweep-interval-ms:30000}")
    public void sweep() {
        Instant now = clock.instant();
        for (Node candidate : nodeRepo.findByEnabledTrueOrderByIdAsc()) {
            if (policy.evaluate(candidate, now) == candidate.getStatus()) {
                continue;
            }
            Transition t;
            synchronized (lockFor(candidate.getId())) {
                t = tx.execute(status -> nodeRepo.findById(candidate.getId()).map(node -> {
                    NodeStatus previous = node.getStatus();
                    node.setStatus(policy.evaluate(node, clock.instant()));
                    return new Transition(nodeRepo.save(node), previous);
                }).orElse(null));
            }
            if (t != null) {
                publishIfChanged(t);
            }
        }
    }

    private void publishIfChanged(Transition t) {
        Node node = t.node();
        if (node.getStatus() == t.previous()) {
            return;
        }
        LOGGER.info("NODE status id={} {} -> {}", node.getId(), t.previous(), node.getStatus());
        events.publish(new NodeStatusEvent(node.getId(), node.getName(), node.getLocation(), node.getStatus(),
                t.previous(), node.getLastSeen(), node.getLatencyMs()));
    }

    private Object lockFor(String nodeId) {
        return locks.computeIfAbsent(nodeId, k -> new Object());
    }
}
