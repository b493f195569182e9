package com.flagship.vote_escrow.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a position is withdrawn, at or before expiry.
 *
 * For an early withdrawal {@code penalty} went to {@code treasury} and the
 * withdrawer received {@code amount - penalty}.
 */
@Value
public class LockWithdrawnEvent implements LockEvent {
    UUID eventId;
    long positionId;
    UUID withdrawer;
    BigInteger amount;
    BigInteger penalty;
    UUID treasury;
    boolean early;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LockWithdrawn";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LockWithdrawnEvent atExpiry(long positionId, UUID withdrawer, BigInteger amount, long now) {
        return new LockWithdrawnEvent(UUID.randomUUID(), positionId, withdrawer, amount, BigInteger.ZERO,
            null, false, Instant.ofEpochSecond(now));
    }

    public static LockWithdrawnEvent early(long positionId, UUID withdrawer, BigInteger amount, BigInteger penalty,
                                           UUID treasury, long now) {
        return new LockWithdrawnEvent(UUID.randomUUID(), positionId, withdrawer, amount, penalty,
            treasury, true, Instant.ofEpochSecond(now));
    }
}
