package com.flagship.vote_escrow.time;

/**
 * Source of "now" for the ledger.
 *
 * Checkpoints carry both a wall-clock timestamp and a block reference. The block
 * reference is opaque to the engine apart from being non-decreasing.
 */
public interface LedgerClock {

    /**
     * Current time in unix seconds.
     */
    long currentTimestamp();

    /**
     * Current block reference.
     */
    long currentBlock();
}
