package com.flagship.vote_escrow.balance;

import com.flagship.vote_escrow.checkpoint.CheckpointHistory;
import com.flagship.vote_escrow.checkpoint.CheckpointSearch;
import com.flagship.vote_escrow.checkpoint.GlobalPoint;
import com.flagship.vote_escrow.checkpoint.GlobalState;
import com.flagship.vote_escrow.checkpoint.UserPoint;
import com.flagship.vote_escrow.time.EpochTime;

import java.math.BigInteger;

/**
 * Reconstructs historical balances from committed checkpoints.
 *
 * Both methods are pure functions of their arguments. Results are rounded
 * down when leaving WAD scale, so a historical balance is never overstated.
 */
public final class BalanceCalculator {

    /**
     * Maximum number of week boundaries walked when replaying the aggregate from
     * its nearest checkpoint (about five years). The global history gets a point
     * at every week boundary it is advanced over, so only a query more than
     * this far past the latest global checkpoint can hit the limit.
     */
    public static final int MAX_REPLAY_WEEKS = 255;

    private BalanceCalculator() {
        // Utility class
    }

    /**
     * Balance of a position at {@code timestamp}.
     *
     * @return 0 before the position's first checkpoint; the permanent amount for a
     *         permanent checkpoint; otherwise the decayed bias floored at zero
     */
    public static BigInteger balanceAt(CheckpointHistory<UserPoint> history, long timestamp) {
        int epoch = CheckpointSearch.indexAtOrBefore(history, timestamp);
        if (epoch == 0) {
            return BigInteger.ZERO;
        }
        UserPoint point = history.get(epoch);
        if (point.isPermanent()) {
            return point.getPermanent();
        }
        BigInteger bias = point.getBias()
            .subtract(point.getSlope().multiply(BigInteger.valueOf(timestamp - point.getTimestamp())));
        if (bias.signum() < 0) {
            return BigInteger.ZERO;
        }
        return SafeCast.intToUint(Wad.unscale(bias));
    }

    /**
     * Total supply at {@code timestamp}: decayed aggregate bias plus the permanent lock balance.
     *
     * @throws SupplyReplayException if the target lies more than {@link #MAX_REPLAY_WEEKS}
     *         week boundaries past the nearest global checkpoint
     */
    public static BigInteger supplyAt(GlobalState state, long timestamp) {
        CheckpointHistory<GlobalPoint> history = state.getHistory();
        int epoch = CheckpointSearch.indexAtOrBefore(history, timestamp);
        if (epoch == 0) {
            return BigInteger.ZERO;
        }
        GlobalPoint point = history.get(epoch);
        BigInteger bias = point.getBias();
        BigInteger slope = point.getSlope();
        long lastTimestamp = point.getTimestamp();

        long weekCursor = lastTimestamp;
        boolean reached = false;
        for (int i = 0; i < MAX_REPLAY_WEEKS; i++) {
            weekCursor = EpochTime.nextWeek(weekCursor);
            BigInteger scheduled = BigInteger.ZERO;
            if (weekCursor > timestamp) {
                weekCursor = timestamp;
            } else {
                scheduled = state.getSchedule().changeAt(weekCursor);
            }
            bias = bias.subtract(slope.multiply(BigInteger.valueOf(weekCursor - lastTimestamp)));
            if (weekCursor == timestamp) {
                reached = true;
                break;
            }
            slope = slope.add(scheduled);
            lastTimestamp = weekCursor;
        }
        if (!reached) {
            throw new SupplyReplayException(point.getTimestamp(), timestamp, MAX_REPLAY_WEEKS);
        }

        if (bias.signum() < 0) {
            bias = BigInteger.ZERO;
        }
        return SafeCast.toUint256(Wad.unscale(bias).add(point.getPermanentLockBalance()));
    }
}
