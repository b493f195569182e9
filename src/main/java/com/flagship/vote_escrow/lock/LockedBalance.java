package com.flagship.vote_escrow.lock;

import lombok.Value;

import java.math.BigInteger;

/**
 * Locked amount and unlock time of a position.
 *
 * While permanent the unlock time is retained so that converting back resumes
 * the original decay curve; {@link #getVisibleEnd()} reports 0 in that case.
 */
@Value
public class LockedBalance {

    public static final LockedBalance EMPTY = new LockedBalance(BigInteger.ZERO, 0L, false);

    BigInteger amount;
    long end;
    boolean permanent;

    public static LockedBalance decaying(BigInteger amount, long end) {
        return new LockedBalance(amount, end, false);
    }

    /**
     * Unlock time that drives decay and the slope schedule; 0 while permanent.
     */
    public long getDecayingEnd() {
        return permanent ? 0L : end;
    }

    public long getVisibleEnd() {
        return getDecayingEnd();
    }

    public BigInteger getPermanentAmount() {
        return permanent ? amount : BigInteger.ZERO;
    }

    public boolean isExpired(long now) {
        return !permanent && end <= now;
    }

    public LockedBalance withAmount(BigInteger newAmount) {
        return new LockedBalance(newAmount, end, permanent);
    }

    public LockedBalance withEnd(long newEnd) {
        return new LockedBalance(amount, newEnd, permanent);
    }

    public LockedBalance toPermanent() {
        return new LockedBalance(amount, end, true);
    }

    public LockedBalance toDecaying() {
        return new LockedBalance(amount, end, false);
    }
}
