package com.example.homemic_backend.service.events;

import com.example.homemic_backend.config.EventsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LiveEventBroadcasterTest {

    private final Instant now = Instant.parse("2024-05-01T10:00:00Z");
    private final Clock clock = Clock.fixed(now, ZoneOffset.UTC);
    private final EventFrameCodec codec = new EventFrameCodec(TestMappers.snakeCase());
    private EventsProperties props;

    @BeforeEach
    void setUp() {
        props = new EventsProperties();
        props.setSubscriberBuffer(4);
        props.setMaxMissedHeartbeats(2);
    }

    @Test
    void initialStateIsFirstFrameThenEventsInPublishOrder() {
        var bus = new LiveEventBroadcaster(codec, this::snapshot, props, Runnable::run, clock);
        var sink = new RecordingSink("a");

        bus.subscribe(sink);
        bus.publish(transcription("one"));
        bus.publish(transcription("two"));

        assertThat(sink.frames).hasSize(3);
        assertThat(codec.typeOf(sink.frames.get(0))).isEqualTo(InitialStateEvent.TYPE);
        assertThat(sink.frames.get(1)).contains("\"one\"");
        assertThat(sink.frames.get(2)).contains("\"two\"");
    }

    @Test
    void eventsPublishedWhileSnapshottingWaitForInitialState() {
        var bus = new LiveEventBroadcaster[1];
        InitialStateProvider racing = () -> {
            bus[0].publish(transcription("during-snapshot"));
            return snapshot();
        };
        bus[0] = new LiveEventBroadcaster(codec, racing, props, Runnable::run, clock);
        var sink = new RecordingSink("a");

        bus[0].subscribe(sink);

        assertThat(sink.frames).hasSize(2);
        assertThat(codec.typeOf(sink.frames.get(0))).isEqualTo(InitialStateEvent.TYPE);
        assertThat(sink.frames.get(1)).contains("during-snapshot");
    }

    @Test
    void slowSubscriberIsDisconnectedWithoutAffectingOthers() {
        var stalled = new ManualExecutor();
        var bus = new LiveEventBroadcaster(codec, this::snapshot, props, stalled, clock);
        var slow = new RecordingSink("slow");
        bus.subscribe(slow);

        for (int i = 0; i < props.getSubscriberBuffer() + 1; i++) {
            bus.publish(transcription("e" + i));
        }

        assertThat(slow.closedWith).isEqualTo("backlog overflow");
        assertThat(bus.subscriberCount()).isZero();

        var fresh = new RecordingSink("fresh");
        bus.subscribe(fresh);
        bus.publish(transcription("after"));
        stalled.runAll();
        assertThat(fresh.frames).hasSize(2);
        assertThat(slow.frames).isEmpty();
    }

    @Test
    void subscriberThatStopsAnsweringHeartbeatsIsDropped() {
        var bus = new LiveEventBroadcaster(codec, this::snapshot, props, Runnable::run, clock);
        var quiet = new RecordingSink("quiet");
        var chatty = new RecordingSink("chatty");
        bus.subscribe(quiet);
        Subscription chattySub = bus.subscribe(chatty);

        for (int i = 0; i < 3; i++) {
            bus.heartbeat();
            chattySub.heartbeatAcknowledged();
        }

        assertThat(quiet.closedWith).isEqualTo("heartbeat timeout");
        assertThat(chatty.closedWith).isNull();
        assertThat(bus.subscriberCount()).isEqualTo(1);
        assertThat(chatty.frames).filteredOn(f -> EventFrameCodec.PING.equals(codec.typeOf(f))).hasSize(3);
    }

    @Test
    void cancelRemovesSubscriber() {
        var bus = new LiveEventBroadcaster(codec, this::snapshot, props, Runnable::run, clock);
        var sink = new RecordingSink("a");
        Subscription sub = bus.subscribe(sink);

        sub.cancel();
        bus.publish(transcription("ignored"));

        assertThat(bus.subscriberCount()).isZero();
        assertThat(sink.frames).hasSize(1);
    }

    @Test
    void concurrentPublishersReachEverySubscriber() throws Exception {
        props.setSubscriberBuffer(1_000);
        ExecutorService delivery = Executors.newFixedThreadPool(4);
        ExecutorService publishers = Executors.newFixedThreadPool(4);
        try {
            var bus = new LiveEventBroadcaster(codec, this::snapshot, props, delivery, clock);
            List<RecordingSink> sinks = List.of(new RecordingSink("a"), new RecordingSink("b"), new RecordingSink("c"));
            sinks.forEach(bus::subscribe);

            CountDownLatch start = new CountDownLatch(1);
            for (int p = 0; p < 4; p++) {
                int publisher = p;
                publishers.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        bus.publish(transcription("p" + publisher + "-" + i));
                    }
                    return null;
                });
            }
            start.countDown();
            publishers.shutdown();
            assertThat(publishers.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

            long deadline = System.currentTimeMillis() + 10_000;
            while (System.currentTimeMillis() < deadline && sinks.stream().anyMatch(s -> s.frames.size() < 201)) {
                Thread.sleep(10);
            }
            for (RecordingSink sink : sinks) {
                assertThat(sink.frames).hasSize(201);
                assertThat(codec.typeOf(sink.frames.get(0))).isEqualTo(InitialStateEvent.TYPE);
            }
        } finally {
            delivery.shutdownNow();
            publishers.shutdownNow();
        }
    }

    private InitialStateEvent snapshot() {
        return new InitialStateEvent(List.of(), List.of(), now);
    }

    private TranscriptionEvent transcription(String text) {
        return new TranscriptionEvent(UUID.randomUUID(), "kitchen", text, 1, 1, 1.0, now, now);
    }

    private static final class ManualExecutor implements java.util.concurrent.Executor {
        private final Queue<Runnable> tasks = new ArrayDeque<>();

        @Override
        public void execute(Runnable command) {
            tasks.add(command);
        }

        void runAll() {
            Runnable next;
            while ((next = tasks.poll()) != null) {
                next.run();
            }
        }
    }
}
