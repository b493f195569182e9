package com.flagship.vote_escrow.balance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class SafeCastTest {

    @Test
    @DisplayName("Values inside int256 pass unchanged, values outside are rejected")
    void testToInt256Bounds() {
        assertEquals(SafeCast.INT256_MAX, SafeCast.toInt256(SafeCast.INT256_MAX));
        assertEquals(SafeCast.INT256_MIN, SafeCast.toInt256(SafeCast.INT256_MIN));

        assertThrows(ArithmeticException.class, () -> SafeCast.toInt256(SafeCast.INT256_MAX.add(BigInteger.ONE)));
        assertThrows(ArithmeticException.class,
            () -> SafeCast.toInt256(SafeCast.INT256_MIN.subtract(BigInteger.ONE)));
    }

    @Test
    @DisplayName("Negative accumulators never become public amounts")
    void testIntToUintRejectsNegative() {
        assertEquals(BigInteger.TEN, SafeCast.intToUint(BigInteger.TEN));
        assertThrows(ArithmeticException.class, () -> SafeCast.intToUint(BigInteger.valueOf(-1)));
    }

    @Test
    @DisplayName("Amounts above int256 cannot enter the accumulator domain")
    void testUintToIntRejectsLargeAmounts() {
        assertThrows(ArithmeticException.class, () -> SafeCast.uintToInt(SafeCast.UINT256_MAX));
        assertThrows(ArithmeticException.class,
            () -> SafeCast.toUint256(SafeCast.UINT256_MAX.add(BigInteger.ONE)));
    }

    @Test
    @DisplayName("WAD rescaling truncates and the slope keeps sub-unit precision")
    void testWadScaling() {
        BigInteger almostTwo = Wad.WAD.multiply(BigInteger.TWO).subtract(BigInteger.ONE);
        assertEquals(BigInteger.ONE, Wad.unscale(almostTwo));
        assertThrows(IllegalArgumentException.class, () -> Wad.unscale(BigInteger.valueOf(-1)));

        // 1 token over 4 seconds decays 0.25 per second
        BigInteger slope = Wad.slopeOf(BigInteger.ONE, 4);
        assertEquals(Wad.WAD.divide(BigInteger.valueOf(4)), slope);
    }
}
