package com.example.homemic_backend.service.events;

public interface Subscription {
    String id();

    /** Resets the missed-heartbeat counter. Called for every pong or other inbound traffic. */
    void heartbeatAcknowledged();

    void cancel();
}
