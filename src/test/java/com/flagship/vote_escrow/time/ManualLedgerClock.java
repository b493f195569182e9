package com.flagship.vote_escrow.time;

/**
 * Test clock that only moves when told to. One block every two seconds.
 */
public class ManualLedgerClock implements LedgerClock {

    private long timestamp;

    public ManualLedgerClock(long timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public synchronized long currentTimestamp() {
        return timestamp;
    }

    @Override
    public synchronized long currentBlock() {
        return timestamp / 2;
    }

    public synchronized void set(long timestamp) {
        this.timestamp = timestamp;
    }

    public synchronized void advance(long seconds) {
        this.timestamp += seconds;
    }
}
