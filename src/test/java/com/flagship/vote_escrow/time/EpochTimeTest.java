package com.flagship.vote_escrow.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EpochTimeTest {

    private static final long WEEK = EpochTime.WEEK;

    @Test
    @DisplayName("Timestamps round down to the start of their week")
    void testWeekStart() {
        assertEquals(604_800L, WEEK);
        assertEquals(0L, EpochTime.weekStart(0));
        assertEquals(0L, EpochTime.weekStart(WEEK - 1));
        assertEquals(WEEK, EpochTime.weekStart(WEEK));
        assertEquals(2810 * WEEK, EpochTime.weekStart(2810 * WEEK + 12_345));
    }

    @Test
    @DisplayName("Next week is strictly after the timestamp")
    void testNextWeek() {
        assertEquals(WEEK, EpochTime.nextWeek(0));
        assertEquals(2 * WEEK, EpochTime.nextWeek(WEEK));
        assertEquals(2 * WEEK, EpochTime.nextWeek(2 * WEEK - 1));
    }

    @Test
    @DisplayName("Only multiples of a week are aligned")
    void testIsWeekAligned() {
        assertTrue(EpochTime.isWeekAligned(0));
        assertTrue(EpochTime.isWeekAligned(52 * WEEK));
        assertFalse(EpochTime.isWeekAligned(52 * WEEK + 1));
    }
}
