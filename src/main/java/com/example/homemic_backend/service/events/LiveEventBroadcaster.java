package com.example.homemic_backend.service.events;

import com.example.homemic_backend.config.EventsProperties;
import com.example.homemic_backend.exception.SubscriberOverflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * In-memory {@link EventBus}. Each subscriber gets a bounded queue drained by its own task, so a
 * slow connection never blocks publishers or other subscribers. A full queue disconnects the
 * subscriber; the client reconnects and receives a fresh {@code initial_state}.
 */
@Component
public class LiveEventBroadcaster implements EventBus {
    private static final Logger LOGGER = LoggerFactory.getLogger(LiveEventBroadcaster.class);

    private final Map<String, SubscriberChannel> subscribers = new ConcurrentHashMap<>();
    private final EventFrameCodec codec;
    private final InitialStateProvider initialState;
    private final EventsProperties props;
    private final Executor deliveryExecutor;
    private final Clock clock;

    public LiveEventBroadcaster(EventFrameCodec codec,
                                InitialStateProvider initialState,
                                EventsProperties props,
                                @Qualifier("eventDeliveryExecutor") Executor deliveryExecutor,
                                Clock clock) {
        this.codec = codec;
        this.initialState = initialState;
        this.props = props;
        this.deliveryExecutor = deliveryExecutor;
        this.clock = clock;
    }

    @Override
    public void publish(PipelineEvent event) {
        String frame = codec.encode(event);
        int delivered = 0;
        for (SubscriberChannel channel : subscribers.values()) {
            if (channel.offer(frame)) {
                delivered++;
            } else {
                overflow(channel);
            }
        }
        LOGGER.debug("EVENT published type={} subscribers={}", event.type(), delivered);
    }

    @Override
    public Subscription subscribe(FrameSink sink) {
        String id = sink.id();
        SubscriberChannel channel = new SubscriberChannel(
                sink,
                props.getSubscriberBuffer(),
                deliveryExecutor,
                this::sendFailed,
                () -> remove(id, "cancelled"));
        // Register before snapshotting so nothing published in between is lost; such events are
        // held back until the snapshot frame has gone out.
        SubscriberChannel previous = subscribers.put(id, channel);
        if (previous != null) {
            previous.close();
        }
        InitialStateEvent snapshot;
        try {
            snapshot = initialState.snapshot();
        } catch (RuntimeException e) {
            subscribers.remove(id, channel);
            channel.close();
            throw e;
        }
        channel.start(codec.encode(snapshot));
        LOGGER.info("SUBSCRIBER connected id={} total={}", id, subscribers.size());
        return channel;
    }

    @Override
    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Sends a ping to every subscriber and drops those that have not answered the last
     * {@code max-missed-heartbeats} pings. Ping frames do not take part in event ordering.
     */
    @Scheduled(fixedDelayString = "${homemic.events.heartbeat-interval-ms:30000}")
    public void heartbeat() {
        if (subscribers.isEmpty()) {
            return;
        }
        String ping = codec.ping(clock.instant());
        for (SubscriberChannel channel : subscribers.values()) {
            if (channel.missedHeartbeats() >= props.getMaxMissedHeartbeats()) {
                LOGGER.warn("SUBSCRIBER heartbeat timeout id={} missed={}", channel.id(), channel.missedHeartbeats());
                disconnect(channel, "heartbeat timeout");
                continue;
            }
            channel.heartbeatMissed();
            if (!channel.offer(ping)) {
                overflow(channel);
            }
        }
    }

    private void overflow(SubscriberChannel channel) {
        var ex = new SubscriberOverflowException(channel.id(), channel.capacity());
        LOGGER.warn("SUBSCRIBER overflow id={} capacity={} - disconnecting: {}", channel.id(), channel.capacity(), ex.getMessage());
        disconnect(channel, "backlog overflow");
    }

    private void sendFailed(SubscriberChannel channel, Throwable error) {
        LOGGER.info("SUBSCRIBER send failed id={} err={}", channel.id(), error.toString());
        disconnect(channel, "send failed");
    }

    private void remove(String id, String reason) {
        SubscriberChannel channel = subscribers.remove(id);
        if (channel != null) {
            channel.close();
            LOGGER.info("SUBSCRIBER disconnected id={} reason={} total={}", id, reason, subscribers.size());
        }
    }

    private void disconnect(SubscriberChannel channel, String reason) {
        if (!subscribers.remove(channel.id(), channel)) {
            return;
        }
        channel.close();
        try {
            channel.sink().close(reason);
        } catch (RuntimeException e) {
            LOGGER.debug("Closing subscriber {} failed: {}", channel.id(), e.toString());
        }
        LOGGER.info("SUBSCRIBER disconnected id={} reason={} total={}", channel.id(), reason, subscribers.size());
    }
}
