package com.flagship.vote_escrow.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a position is split in two.
 *
 * The event is keyed by the burned source position.
 */
@Value
public class LockSplitEvent implements LockEvent {
    UUID eventId;
    long positionId;
    long firstId;
    long secondId;
    UUID sender;
    BigInteger firstAmount;
    BigInteger secondAmount;
    long unlockTime;
    boolean permanent;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LockSplit";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
