package com.flagship.vote_escrow.checkpoint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointSearchTest {

    private static CheckpointHistory<UserPoint> historyAt(long... timestamps) {
        CheckpointHistory<UserPoint> history = CheckpointHistory.empty();
        for (long timestamp : timestamps) {
            history = history.append(new UserPoint(BigInteger.ZERO, BigInteger.ZERO, timestamp, timestamp,
                BigInteger.ZERO));
        }
        return history;
    }

    @Test
    @DisplayName("Empty history resolves to epoch 0")
    void testEmptyHistory() {
        assertEquals(0, CheckpointSearch.indexAtOrBefore(CheckpointHistory.empty(), 1_000));
    }

    @Test
    @DisplayName("Finds the checkpoint at or immediately before the target")
    void testIndexAtOrBefore() {
        CheckpointHistory<UserPoint> history = historyAt(10, 20, 30, 40);

        assertEquals(0, CheckpointSearch.indexAtOrBefore(history, 5));
        assertEquals(1, CheckpointSearch.indexAtOrBefore(history, 10));
        assertEquals(1, CheckpointSearch.indexAtOrBefore(history, 15));
        assertEquals(2, CheckpointSearch.indexAtOrBefore(history, 20));
        assertEquals(3, CheckpointSearch.indexAtOrBefore(history, 35));
        assertEquals(4, CheckpointSearch.indexAtOrBefore(history, 40));
        assertEquals(4, CheckpointSearch.indexAtOrBefore(history, Long.MAX_VALUE));
    }

    @Test
    @DisplayName("Single checkpoint history")
    void testSingleCheckpoint() {
        CheckpointHistory<UserPoint> history = historyAt(100);

        assertEquals(0, CheckpointSearch.indexAtOrBefore(history, 99));
        assertEquals(1, CheckpointSearch.indexAtOrBefore(history, 100));
        assertEquals(1, CheckpointSearch.indexAtOrBefore(history, 101));
    }

    @Test
    @DisplayName("Binary search agrees with a linear scan")
    void testAgreesWithLinearScan() {
        Random random = new Random(42);
        long[] timestamps = new long[257];
        long timestamp = 1_000;
        for (int i = 0; i < timestamps.length; i++) {
            timestamp += 1 + random.nextInt(10_000);
            timestamps[i] = timestamp;
        }
        CheckpointHistory<UserPoint> history = historyAt(timestamps);

        for (int i = 0; i < 2_000; i++) {
            long target = random.nextInt((int) timestamp + 20_000);
            int expected = 0;
            for (int epoch = 1; epoch <= timestamps.length; epoch++) {
                if (timestamps[epoch - 1] <= target) {
                    expected = epoch;
                }
            }
            assertEquals(expected, CheckpointSearch.indexAtOrBefore(history, target), "target=" + target);
        }
    }
}
