package com.example.homemic_backend.service.events;

/**
 * Fan-out of pipeline events to live subscribers. Events from one publishing thread reach every
 * subscriber in publish order; no order is promised across publishers.
 */
public interface EventBus {

    void publish(PipelineEvent event);

    /**
     * Registers a sink. The first frame it receives is always {@code initial_state}.
     */
    Subscription subscribe(FrameSink sink);

    int subscriberCount();
}
