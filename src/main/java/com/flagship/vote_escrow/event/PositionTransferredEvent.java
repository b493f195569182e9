package com.flagship.vote_escrow.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a position changes owner.
 */
@Value
public class PositionTransferredEvent implements LockEvent {
    UUID eventId;
    long positionId;
    UUID from;
    UUID to;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PositionTransferred";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PositionTransferredEvent of(long positionId, UUID from, UUID to, long now) {
        return new PositionTransferredEvent(UUID.randomUUID(), positionId, from, to, Instant.ofEpochSecond(now));
    }
}
