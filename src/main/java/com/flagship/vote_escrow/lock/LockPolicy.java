package com.flagship.vote_escrow.lock;

import lombok.Value;

/**
 * Fixed lock duration bounds.
 *
 * {@code maxDuration} is also the MAXTIME divisor of the slope: a lock of the
 * maximum duration starts with a weight equal to its amount.
 */
@Value
public class LockPolicy {
    long maxDuration;
    long minDuration;

    public LockPolicy(long maxDuration, long minDuration) {
        if (maxDuration <= 0 || minDuration < 0 || minDuration > maxDuration) {
            throw new IllegalArgumentException(
                String.format("Invalid lock bounds: min=%d, max=%d", minDuration, maxDuration));
        }
        this.maxDuration = maxDuration;
        this.minDuration = minDuration;
    }
}
