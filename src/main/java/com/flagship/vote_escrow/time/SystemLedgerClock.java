package com.flagship.vote_escrow.time;

import java.time.Clock;

/**
 * Ledger clock backed by the system clock.
 *
 * Block references are derived from the timestamp at a fixed block time, which
 * keeps them monotonic without an external chain.
 */
public class SystemLedgerClock implements LedgerClock {

    private final Clock clock;
    private final long blockTimeSeconds;

    public SystemLedgerClock(Clock clock, long blockTimeSeconds) {
        if (blockTimeSeconds <= 0) {
            throw new IllegalArgumentException("Block time must be positive: " + blockTimeSeconds);
        }
        this.clock = clock;
        this.blockTimeSeconds = blockTimeSeconds;
    }

    @Override
    public long currentTimestamp() {
        return clock.instant().getEpochSecond();
    }

    @Override
    public long currentBlock() {
        return currentTimestamp() / blockTimeSeconds;
    }
}
