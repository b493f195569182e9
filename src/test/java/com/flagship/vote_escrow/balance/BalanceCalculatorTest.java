package com.flagship.vote_escrow.balance;

import com.flagship.vote_escrow.checkpoint.CheckpointHistory;
import com.flagship.vote_escrow.checkpoint.GlobalPoint;
import com.flagship.vote_escrow.checkpoint.GlobalState;
import com.flagship.vote_escrow.checkpoint.SlopeSchedule;
import com.flagship.vote_escrow.checkpoint.UserPoint;
import com.flagship.vote_escrow.time.EpochTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class BalanceCalculatorTest {

    private static final long WEEK = EpochTime.WEEK;
    private static final long DAY = 86_400L;
    private static final long START = 2810 * WEEK;
    private static final BigInteger WAD = Wad.WAD;

    private static BigInteger wad(long value) {
        return BigInteger.valueOf(value).multiply(WAD);
    }

    @Test
    @DisplayName("Decaying balance follows bias - slope * elapsed, floored at zero")
    void testDecayingBalance() {
        // slope of 1 unit per second, 1000 units of bias
        CheckpointHistory<UserPoint> history = CheckpointHistory.<UserPoint>empty()
            .append(new UserPoint(wad(1_000), WAD, START, 1, BigInteger.ZERO));

        assertEquals(BigInteger.ZERO, BalanceCalculator.balanceAt(history, START - 1));
        assertEquals(BigInteger.valueOf(1_000), BalanceCalculator.balanceAt(history, START));
        assertEquals(BigInteger.valueOf(600), BalanceCalculator.balanceAt(history, START + 400));
        assertEquals(BigInteger.ZERO, BalanceCalculator.balanceAt(history, START + 1_000));
        assertEquals(BigInteger.ZERO, BalanceCalculator.balanceAt(history, START + 5_000));
    }

    @Test
    @DisplayName("Balances round down when leaving WAD scale")
    void testBalanceRoundsDown() {
        BigInteger slope = WAD.divide(BigInteger.valueOf(3));
        CheckpointHistory<UserPoint> history = CheckpointHistory.<UserPoint>empty()
            .append(new UserPoint(slope.multiply(BigInteger.valueOf(10)), slope, START, 1, BigInteger.ZERO));

        // 10/3 units left
        assertEquals(BigInteger.valueOf(3), BalanceCalculator.balanceAt(history, START));
    }

    @Test
    @DisplayName("Permanent checkpoints report the permanent amount regardless of time")
    void testPermanentBalance() {
        CheckpointHistory<UserPoint> history = CheckpointHistory.<UserPoint>empty()
            .append(new UserPoint(wad(1_000), WAD, START, 1, BigInteger.ZERO))
            .append(new UserPoint(BigInteger.ZERO, BigInteger.ZERO, START + 100, 2, BigInteger.valueOf(777)));

        assertEquals(BigInteger.valueOf(950), BalanceCalculator.balanceAt(history, START + 50));
        assertEquals(BigInteger.valueOf(777), BalanceCalculator.balanceAt(history, START + 100));
        assertEquals(BigInteger.valueOf(777), BalanceCalculator.balanceAt(history, START + 100 * WEEK));
    }

    /**
     * Two locks checkpointed at START: one expiring after one week (slope 3),
     * one after two weeks (slope 2).
     */
    private static GlobalState twoLockState(long permanentBalance) {
        BigInteger slopeA = wad(3);
        BigInteger slopeB = wad(2);
        BigInteger bias = slopeA.multiply(BigInteger.valueOf(WEEK)).add(slopeB.multiply(BigInteger.valueOf(2 * WEEK)));
        CheckpointHistory<GlobalPoint> history = CheckpointHistory.<GlobalPoint>empty()
            .append(new GlobalPoint(bias, slopeA.add(slopeB), START, 1, BigInteger.valueOf(permanentBalance)));
        SlopeSchedule schedule = SlopeSchedule.empty().toBuilder()
            .put(START + WEEK, slopeA.negate())
            .put(START + 2 * WEEK, slopeB.negate())
            .build();
        return new GlobalState(history, schedule, BigInteger.valueOf(permanentBalance), 2);
    }

    @Test
    @DisplayName("Supply replay applies scheduled slope changes at week boundaries")
    void testSupplyReplaysSlopeChanges() {
        GlobalState state = twoLockState(0);

        assertEquals(BigInteger.ZERO, BalanceCalculator.supplyAt(state, START - 1));
        assertEquals(BigInteger.valueOf(7 * WEEK), BalanceCalculator.supplyAt(state, START));
        // exactly on the boundary the first lock has just run out
        assertEquals(BigInteger.valueOf(2 * WEEK), BalanceCalculator.supplyAt(state, START + WEEK));
        assertEquals(BigInteger.valueOf(2 * (WEEK - DAY)), BalanceCalculator.supplyAt(state, START + WEEK + DAY));
        assertEquals(BigInteger.ZERO, BalanceCalculator.supplyAt(state, START + 2 * WEEK));
        assertEquals(BigInteger.ZERO, BalanceCalculator.supplyAt(state, START + 10 * WEEK));
    }

    @Test
    @DisplayName("Permanent lock balance is added on top of the decayed bias")
    void testSupplyIncludesPermanentBalance() {
        GlobalState state = twoLockState(500);

        assertEquals(BigInteger.valueOf(7 * WEEK + 500), BalanceCalculator.supplyAt(state, START));
        assertEquals(BigInteger.valueOf(500), BalanceCalculator.supplyAt(state, START + 3 * WEEK));
    }

    @Test
    @DisplayName("Replaying more than 255 weeks past the nearest checkpoint fails")
    void testReplayLimit() {
        GlobalState state = twoLockState(0);

        assertEquals(BigInteger.ZERO,
            BalanceCalculator.supplyAt(state, START + BalanceCalculator.MAX_REPLAY_WEEKS * WEEK));

        SupplyReplayException e = assertThrows(SupplyReplayException.class,
            () -> BalanceCalculator.supplyAt(state, START + 256 * WEEK));
        assertTrue(e.getMessage().contains("255"));
    }
}
