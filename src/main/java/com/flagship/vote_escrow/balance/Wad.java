package com.flagship.vote_escrow.balance;

import java.math.BigInteger;

/**
 * 18-decimal fixed-point scaling used for bias and slope accumulators.
 *
 * Public amounts are in token base units. Slopes are stored as
 * {@code amount * WAD / maxTime} so that per-second decay keeps its precision,
 * and balances are rescaled with {@link #unscale(BigInteger)}, which truncates.
 */
public final class Wad {

    public static final BigInteger WAD = BigInteger.TEN.pow(18);

    private Wad() {
        // Utility class
    }

    public static BigInteger scale(BigInteger value) {
        return value.multiply(WAD);
    }

    /**
     * Rescales a non-negative WAD value to the public unit, rounding down.
     */
    public static BigInteger unscale(BigInteger wadValue) {
        if (wadValue.signum() < 0) {
            throw new IllegalArgumentException("Cannot unscale a negative value: " + wadValue);
        }
        return wadValue.divide(WAD);
    }

    /**
     * Decay rate of a locked amount: {@code amount * WAD / maxTime}.
     */
    public static BigInteger slopeOf(BigInteger amount, long maxTime) {
        return SafeCast.toInt256(scale(amount).divide(BigInteger.valueOf(maxTime)));
    }
}
