package com.example.homemic_backend.service;

import com.example.homemic_backend.config.WorkerProperties;

import java.time.Duration;

/**
 * Bounded exponential backoff: the n-th failed attempt waits {@code base * 2^(n-1)}, capped at {@code max}.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    }

    public static RetryPolicy from(WorkerProperties props) {
        return new RetryPolicy(props.getMaxAttempts(), props.getBackoffBase(), props.getBackoffMax());
    }

    public boolean exhausted(int attempts) {
        return attempts >= maxAttempts;
    }

    public Duration delayAfter(int attempt) {
        int shift = Math.max(0, Math.min(attempt - 1, 30));
        long millis = baseDelay.toMillis() * (1L << shift);
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }
}
