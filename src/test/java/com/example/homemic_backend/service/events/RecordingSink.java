package com.example.homemic_backend.service.events;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingSink implements FrameSink {
    private final String id;
    final List<String> frames = new CopyOnWriteArrayList<>();
    volatile String closedWith;

    RecordingSink(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String frame) {
        frames.add(frame);
    }

    @Override
    public void close(String reason) {
        closedWith = reason;
    }
}
