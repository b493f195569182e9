package com.flagship.vote_escrow.checkpoint;

import com.flagship.vote_escrow.time.EpochTime;

import java.math.BigInteger;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Week-aligned timestamp to pending slope delta.
 *
 * Instances are immutable; {@link #toBuilder()} gives a mutable copy for one
 * write, and zero deltas are never stored.
 */
public final class SlopeSchedule {

    private static final SlopeSchedule EMPTY = new SlopeSchedule(new TreeMap<>());

    private final NavigableMap<Long, BigInteger> changes;

    private SlopeSchedule(NavigableMap<Long, BigInteger> changes) {
        this.changes = Collections.unmodifiableNavigableMap(changes);
    }

    public static SlopeSchedule empty() {
        return EMPTY;
    }

    public BigInteger changeAt(long timestamp) {
        return changes.getOrDefault(timestamp, BigInteger.ZERO);
    }

    public Builder toBuilder() {
        return new Builder(new TreeMap<>(changes));
    }

    public static final class Builder {

        private final TreeMap<Long, BigInteger> changes;

        private Builder(TreeMap<Long, BigInteger> changes) {
            this.changes = changes;
        }

        public BigInteger changeAt(long timestamp) {
            return changes.getOrDefault(timestamp, BigInteger.ZERO);
        }

        /**
         * @throws IllegalArgumentException if {@code timestamp} is not a week boundary
         */
        public Builder put(long timestamp, BigInteger delta) {
            if (!EpochTime.isWeekAligned(timestamp)) {
                throw new IllegalArgumentException("Slope change at " + timestamp + " is not week aligned");
            }
            if (delta.signum() == 0) {
                changes.remove(timestamp);
            } else {
                changes.put(timestamp, delta);
            }
            return this;
        }

        public SlopeSchedule build() {
            return new SlopeSchedule(new TreeMap<>(changes));
        }
    }
}
