package com.flagship.vote_escrow.balance;

import java.math.BigInteger;

/**
 * Range checks between the signed accumulator type and the public unsigned unit.
 *
 * Accumulators (bias, slope, slope deltas) are 256-bit signed values and public
 * amounts are 256-bit unsigned values. Every value crossing that boundary goes
 * through one of these methods; a value out of range raises
 * {@link ArithmeticException} instead of being truncated.
 */
public final class SafeCast {

    public static final BigInteger INT256_MAX = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);
    public static final BigInteger INT256_MIN = BigInteger.ONE.shiftLeft(255).negate();
    public static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private SafeCast() {
        // Utility class
    }

    public static BigInteger toInt256(BigInteger value) {
        if (value.compareTo(INT256_MIN) < 0 || value.compareTo(INT256_MAX) > 0) {
            throw new ArithmeticException("Value does not fit in int256: " + value);
        }
        return value;
    }

    public static BigInteger toUint256(BigInteger value) {
        if (value.signum() < 0 || value.compareTo(UINT256_MAX) > 0) {
            throw new ArithmeticException("Value does not fit in uint256: " + value);
        }
        return value;
    }

    /**
     * Converts a public amount to the signed accumulator domain.
     */
    public static BigInteger uintToInt(BigInteger value) {
        return toInt256(toUint256(value));
    }

    /**
     * Converts a non-negative accumulator to the public unsigned domain.
     */
    public static BigInteger intToUint(BigInteger value) {
        return toUint256(toInt256(value));
    }
}
