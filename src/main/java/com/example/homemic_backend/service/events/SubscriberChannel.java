package com.example.homemic_backend.service.events;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * Bounded outbound queue for one subscriber, drained by at most one task at a time.
 * Frames offered before {@link #start(String)} are held until the initial frame has been sent.
 */
final class SubscriberChannel implements Subscription {

    private final FrameSink sink;
    private final BlockingQueue<String> queue;
    private final int capacity;
    private final Executor executor;
    private final BiConsumer<SubscriberChannel, Throwable> onSendFailure;
    private final Runnable onCancel;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicInteger missedHeartbeats = new AtomicInteger();
    private volatile boolean started;
    private volatile boolean closed;
    private volatile String initialFrame;

    SubscriberChannel(FrameSink sink, int capacity, Executor executor,
                      BiConsumer<SubscriberChannel, Throwable> onSendFailure, Runnable onCancel) {
        this.sink = sink;
        this.capacity = Math.max(1, capacity);
        this.queue = new ArrayBlockingQueue<>(this.capacity);
        this.executor = executor;
        this.onSendFailure = onSendFailure;
        this.onCancel = onCancel;
    }

    @Override
    public String id() {
        return sink.id();
    }

    int capacity() {
        return capacity;
    }

    FrameSink sink() {
        return sink;
    }

    void start(String initial) {
        this.initialFrame = initial;
        this.started = true;
        scheduleDrain();
    }

    /**
     * @return {@code false} when the buffer is full; the caller must disconnect this subscriber
     */
    boolean offer(String frame) {
        if (closed) {
            return true;
        }
        if (!queue.offer(frame)) {
            return false;
        }
        scheduleDrain();
        return true;
    }

    int heartbeatMissed() {
        return missedHeartbeats.incrementAndGet();
    }

    int missedHeartbeats() {
        return missedHeartbeats.get();
    }

    @Override
    public void heartbeatAcknowledged() {
        missedHeartbeats.set(0);
    }

    @Override
    public void cancel() {
        onCancel.run();
    }

    boolean isClosed() {
        return closed;
    }

    void close() {
        closed = true;
        queue.clear();
    }

    private void scheduleDrain() {
        if (!started || closed) {
            return;
        }
        if (draining.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            while (!closed) {
                String next = initialFrame;
                if (next != null) {
                    initialFrame = null;
                } else {
                    next = queue.poll();
                }
                if (next == null) {
                    break;
                }
                sink.send(next);
            }
        } catch (IOException | RuntimeException e) {
            onSendFailure.accept(this, e);
        } finally {
            draining.set(false);
        }
        // A frame offered while we were finishing would otherwise wait for the next offer.
        if (!closed && !queue.isEmpty()) {
            scheduleDrain();
        }
    }
}
