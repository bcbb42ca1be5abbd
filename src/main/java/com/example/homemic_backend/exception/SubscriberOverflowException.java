package com.example.homemic_backend.exception;

public class SubscriberOverflowException extends HomeMicException {

    private final String subscriberId;

    public SubscriberOverflowException(String subscriberId, int capacity) {
        super("Subscriber " + subscriberId + " exceeded outbound buffer of " + capacity + " frames");
        this.subscriberId = subscriberId;
    }

    public String getSubscriberId() {
        return subscriberId;
    }
}
