package com.flagship.vote_escrow.checkpoint;

import com.flagship.vote_escrow.time.EpochTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class SlopeScheduleTest {

    private static final long WEEK = EpochTime.WEEK;
    private static final long START = 2810 * WEEK;

    @Test
    @DisplayName("Builders copy the schedule and leave the original untouched")
    void testBuilderIsACopy() {
        SlopeSchedule base = SlopeSchedule.empty().toBuilder()
            .put(START + WEEK, BigInteger.valueOf(-5))
            .build();

        SlopeSchedule changed = base.toBuilder()
            .put(START + WEEK, BigInteger.valueOf(-7))
            .put(START + 2 * WEEK, BigInteger.valueOf(-3))
            .build();

        assertEquals(BigInteger.valueOf(-5), base.changeAt(START + WEEK));
        assertEquals(BigInteger.ZERO, base.changeAt(START + 2 * WEEK));
        assertEquals(BigInteger.valueOf(-7), changed.changeAt(START + WEEK));
        assertEquals(BigInteger.valueOf(-3), changed.changeAt(START + 2 * WEEK));
    }

    @Test
    @DisplayName("Zero deltas clear the entry")
    void testZeroDeltaRemoves() {
        SlopeSchedule.Builder builder = SlopeSchedule.empty().toBuilder().put(START, BigInteger.TEN);
        builder.put(START, BigInteger.ZERO);

        assertEquals(BigInteger.ZERO, builder.changeAt(START));
        assertEquals(BigInteger.ZERO, builder.build().changeAt(START));
    }

    @Test
    @DisplayName("Slope changes off a week boundary are rejected")
    void testRejectsUnalignedTimestamps() {
        SlopeSchedule.Builder builder = SlopeSchedule.empty().toBuilder();

        assertThrows(IllegalArgumentException.class, () -> builder.put(START + 1, BigInteger.ONE));
        assertThrows(IllegalArgumentException.class, () -> builder.put(START + WEEK - 1, BigInteger.ONE));
        assertEquals(BigInteger.ZERO, builder.build().changeAt(START + 1));
    }
}
