package com.flagship.vote_escrow.checkpoint;

import java.math.BigInteger;

/**
 * A timestamped (bias, slope) snapshot, either for one position or for the aggregate.
 */
public interface Checkpoint {

    /**
     * Decay-adjusted weight at {@link #getTimestamp()}, WAD-scaled.
     */
    BigInteger getBias();

    /**
     * Per-second decay rate, WAD-scaled.
     */
    BigInteger getSlope();

    long getTimestamp();

    long getBlock();
}
