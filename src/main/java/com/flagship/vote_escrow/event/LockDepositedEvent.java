package com.flagship.vote_escrow.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when value or time is added to a position.
 *
 * {@code amount} is the deposited amount (zero for pure unlock time extensions),
 * {@code lockedAmount} the position's total afterwards.
 */
@Value
public class LockDepositedEvent implements LockEvent {
    UUID eventId;
    long positionId;
    UUID owner;
    UUID depositor;
    BigInteger amount;
    BigInteger lockedAmount;
    long unlockTime;
    DepositType depositType;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LockDeposited";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LockDepositedEvent of(long positionId, UUID owner, UUID depositor, BigInteger amount,
                                        BigInteger lockedAmount, long unlockTime, DepositType type, long now) {
        return new LockDepositedEvent(UUID.randomUUID(), positionId, owner, depositor, amount, lockedAmount,
            unlockTime, type, Instant.ofEpochSecond(now));
    }
}
