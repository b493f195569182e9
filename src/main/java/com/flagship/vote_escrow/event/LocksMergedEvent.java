package com.flagship.vote_escrow.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when one position is merged into another.
 *
 * The event is keyed by the surviving position.
 */
@Value
public class LocksMergedEvent implements LockEvent {
    UUID eventId;
    long positionId;
    long mergedFromId;
    UUID sender;
    BigInteger amountFrom;
    BigInteger amountTo;
    BigInteger amountFinal;
    long unlockTime;
    boolean permanent;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LocksMerged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
