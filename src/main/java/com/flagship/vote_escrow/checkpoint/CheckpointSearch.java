package com.flagship.vote_escrow.checkpoint;

import java.util.function.IntToLongFunction;

/**
 * Binary-search indexer shared by per-position and global histories.
 */
public final class CheckpointSearch {

    private CheckpointSearch() {
        // Utility class
    }

    /**
     * Finds the epoch of the checkpoint at or immediately before {@code timestamp}.
     *
     * @param epochCount  number of checkpoints (epochs are 1-based)
     * @param timestampAt timestamp of the checkpoint at a given epoch
     * @param timestamp   target time
     * @return the epoch, or 0 when the history is empty or starts after the target
     */
    public static int indexAtOrBefore(int epochCount, IntToLongFunction timestampAt, long timestamp) {
        if (epochCount == 0) {
            return 0;
        }
        if (timestampAt.applyAsLong(epochCount) <= timestamp) {
            return epochCount;
        }
        if (timestampAt.applyAsLong(1) > timestamp) {
            return 0;
        }

        int lower = 0;
        int upper = epochCount;
        while (upper > lower) {
            // ceiling midpoint, never evaluates epoch 0
            int center = upper - (upper - lower) / 2;
            long centerTimestamp = timestampAt.applyAsLong(center);
            if (centerTimestamp == timestamp) {
                return center;
            } else if (centerTimestamp < timestamp) {
                lower = center;
            } else {
                upper = center - 1;
            }
        }
        return lower;
    }

    public static int indexAtOrBefore(CheckpointHistory<? extends Checkpoint> history, long timestamp) {
        return indexAtOrBefore(history.epoch(), epoch -> history.get(epoch).getTimestamp(), timestamp);
    }
}
