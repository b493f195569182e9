package com.flagship.vote_escrow.checkpoint;

import lombok.Value;

import java.math.BigInteger;

/**
 * Checkpoint of the aggregate over all positions.
 *
 * Bias and slope sum the contributions of every active decaying position.
 * {@code permanentLockBalance} sums the amounts of every permanent position and
 * is added to the decayed bias unchanged.
 */
@Value
public class GlobalPoint implements Checkpoint {
    BigInteger bias;
    BigInteger slope;
    long timestamp;
    long block;
    BigInteger permanentLockBalance;

    public static GlobalPoint origin(long timestamp, long block) {
        return new GlobalPoint(BigInteger.ZERO, BigInteger.ZERO, timestamp, block, BigInteger.ZERO);
    }
}
