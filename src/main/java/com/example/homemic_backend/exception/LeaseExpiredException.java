package com.example.homemic_backend.exception;

import java.util.UUID;

/**
 * A worker tried to commit or renew with a lease it no longer holds. Never surfaced to users.
 */
public class LeaseExpiredException extends HomeMicException {

    private final UUID clipId;
    private final UUID leaseId;

    public LeaseExpiredException(UUID clipId, UUID leaseId) {
        super("Lease " + leaseId + " on clip " + clipId + " is no longer held");
        this.clipId = clipId;
        this.leaseId = leaseId;
    }

    public UUID getClipId() {
        return clipId;
    }

    public UUID getLeaseId() {
        return leaseId;
    }
}
