package com.flagship.vote_escrow.checkpoint;

import lombok.Value;

import java.math.BigInteger;

/**
 * Everything the aggregate supply depends on, published as one immutable unit.
 */
@Value
public class GlobalState {
    CheckpointHistory<GlobalPoint> history;
    SlopeSchedule schedule;
    BigInteger permanentLockBalance;
    long lastPositionId;

    public static GlobalState genesis() {
        return new GlobalState(CheckpointHistory.empty(), SlopeSchedule.empty(), BigInteger.ZERO, 0L);
    }
}
