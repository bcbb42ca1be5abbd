package com.example.homemic_backend.service.events;

import java.io.IOException;

/**
 * Outbound side of one live connection. Calls are serialised per sink by the broadcaster.
 */
public interface FrameSink {
    String id();

    void send(String frame) throws IOException;

    void close(String reason);
}
