package com.flagship.vote_escrow.time;

/**
 * Week alignment for lock expirations and scheduled slope changes.
 *
 * All timestamps are unix seconds. Week boundaries are multiples of {@link #WEEK}
 * counted from the unix epoch (Thursday 00:00 UTC).
 */
public final class EpochTime {

    public static final long WEEK = 7L * 24 * 60 * 60;

    private EpochTime() {
        // Utility class
    }

    /**
     * Rounds a timestamp down to the start of the week containing it.
     */
    public static long weekStart(long timestamp) {
        return (timestamp / WEEK) * WEEK;
    }

    /**
     * Returns the first week boundary strictly after the given timestamp.
     */
    public static long nextWeek(long timestamp) {
        return weekStart(timestamp) + WEEK;
    }

    public static boolean isWeekAligned(long timestamp) {
        return timestamp % WEEK == 0;
    }
}
