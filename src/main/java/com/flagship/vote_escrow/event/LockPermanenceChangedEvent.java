package com.flagship.vote_escrow.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a position is converted to or from a permanent lock.
 */
@Value
public class LockPermanenceChangedEvent implements LockEvent {
    UUID eventId;
    long positionId;
    UUID owner;
    BigInteger amount;
    boolean permanent;
    long unlockTime;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LockPermanenceChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LockPermanenceChangedEvent of(long positionId, UUID owner, BigInteger amount, boolean permanent,
                                                long unlockTime, long now) {
        return new LockPermanenceChangedEvent(UUID.randomUUID(), positionId, owner, amount, permanent, unlockTime,
            Instant.ofEpochSecond(now));
    }
}
