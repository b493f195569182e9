package com.flagship.vote_escrow.balance;

/**
 * Raised when a supply query lies too far past the nearest global checkpoint to
 * be replayed exactly. Calling a global checkpoint moves the aggregate forward
 * and makes such queries answerable again.
 */
public class SupplyReplayException extends RuntimeException {

    private final long checkpointTimestamp;
    private final long targetTimestamp;

    public SupplyReplayException(long checkpointTimestamp, long targetTimestamp, int maxWeeks) {
        super(String.format("Cannot replay supply from checkpoint at %d to %d: more than %d weeks",
            checkpointTimestamp, targetTimestamp, maxWeeks));
        this.checkpointTimestamp = checkpointTimestamp;
        this.targetTimestamp = targetTimestamp;
    }

    public long getCheckpointTimestamp() {
        return checkpointTimestamp;
    }

    public long getTargetTimestamp() {
        return targetTimestamp;
    }
}
