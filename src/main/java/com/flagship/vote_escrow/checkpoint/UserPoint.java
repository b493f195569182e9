package com.flagship.vote_escrow.checkpoint;

import lombok.Value;

import java.math.BigInteger;

/**
 * Checkpoint of a single position.
 *
 * For a decaying position {@code permanent} is zero and the balance at time t is
 * {@code bias - slope * (t - timestamp)}, floored at zero. For a permanent
 * position bias and slope are zero and the balance is {@code permanent}.
 */
@Value
public class UserPoint implements Checkpoint {
    BigInteger bias;
    BigInteger slope;
    long timestamp;
    long block;
    BigInteger permanent;

    public boolean isPermanent() {
        return permanent.signum() != 0;
    }
}
