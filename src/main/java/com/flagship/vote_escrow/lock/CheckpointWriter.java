package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.balance.SafeCast;
import com.flagship.vote_escrow.balance.Wad;
import com.flagship.vote_escrow.checkpoint.CheckpointHistory;
import com.flagship.vote_escrow.checkpoint.GlobalPoint;
import com.flagship.vote_escrow.checkpoint.UserPoint;
import com.flagship.vote_escrow.time.EpochTime;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Re-checkpoints a position and the global aggregate for one lock change.
 *
 * For a change from {@code oldLocked} to {@code newLocked} this:
 * 1. Replays the global point from its last checkpoint to now, week by week,
 *    applying scheduled slope changes and appending one point per week boundary
 * 2. Swaps the position's old (bias, slope) contribution for the new one
 * 3. Records the new global point and the new user point
 * 4. Moves the position's scheduled slope change to its new unlock time
 *
 * Permanent locks contribute no bias or slope; their amount is carried in the
 * global permanent lock balance instead.
 */
@Slf4j
public class CheckpointWriter {

    private final long maxTime;

    public CheckpointWriter(LockPolicy policy) {
        this.maxTime = policy.getMaxDuration();
    }

    /**
     * Advances the global aggregate to the transaction time without touching a position.
     */
    public void checkpointGlobal(LedgerTransaction tx) {
        GlobalPoint point = advanceGlobal(tx);
        tx.recordGlobalPoint(new GlobalPoint(point.getBias(), point.getSlope(), tx.now(), tx.block(),
            tx.permanentLockBalance()));
    }

    /**
     * Checkpoints one position change.
     *
     * @param userHistory the position's history before the change (empty for a new position)
     * @return the position's history after the change
     */
    public CheckpointHistory<UserPoint> checkpoint(LedgerTransaction tx, CheckpointHistory<UserPoint> userHistory,
                                                   LockedBalance oldLocked, LockedBalance newLocked) {
        long now = tx.now();
        long oldEnd = oldLocked.getDecayingEnd();
        long newEnd = newLocked.getDecayingEnd();

        BigInteger oldSlope = BigInteger.ZERO;
        BigInteger oldBias = BigInteger.ZERO;
        BigInteger newSlope = BigInteger.ZERO;
        BigInteger newBias = BigInteger.ZERO;

        if (oldEnd > now && oldLocked.getAmount().signum() > 0) {
            oldSlope = Wad.slopeOf(oldLocked.getAmount(), maxTime);
            oldBias = SafeCast.toInt256(oldSlope.multiply(BigInteger.valueOf(oldEnd - now)));
        }
        if (newEnd > now && newLocked.getAmount().signum() > 0) {
            newSlope = Wad.slopeOf(newLocked.getAmount(), maxTime);
            newBias = SafeCast.toInt256(newSlope.multiply(BigInteger.valueOf(newEnd - now)));
        }

        // read before the replay consumes anything scheduled at now
        BigInteger oldDslope = oldEnd != 0 ? tx.slopeChange(oldEnd) : BigInteger.ZERO;
        BigInteger newDslope = BigInteger.ZERO;
        if (newEnd != 0) {
            newDslope = newEnd == oldEnd ? oldDslope : tx.slopeChange(newEnd);
        }

        tx.adjustPermanentLockBalance(newLocked.getPermanentAmount().subtract(oldLocked.getPermanentAmount()));

        GlobalPoint replayed = advanceGlobal(tx);
        BigInteger slope = clampNonNegative(replayed.getSlope().add(newSlope).subtract(oldSlope));
        BigInteger bias = clampNonNegative(replayed.getBias().add(newBias).subtract(oldBias));
        tx.recordGlobalPoint(new GlobalPoint(SafeCast.toInt256(bias), SafeCast.toInt256(slope), now, tx.block(),
            SafeCast.toUint256(tx.permanentLockBalance())));

        if (oldEnd > now) {
            // the old contribution no longer expires at oldEnd
            oldDslope = oldDslope.add(oldSlope);
            if (newEnd == oldEnd) {
                oldDslope = oldDslope.subtract(newSlope);
            }
            tx.setSlopeChange(oldEnd, SafeCast.toInt256(oldDslope));
        }
        if (newEnd > now && newEnd > oldEnd) {
            newDslope = newDslope.subtract(newSlope);
            tx.setSlopeChange(newEnd, SafeCast.toInt256(newDslope));
        }

        UserPoint userPoint = new UserPoint(newBias, newSlope, now, tx.block(),
            SafeCast.toUint256(newLocked.getPermanentAmount()));
        log.debug("Checkpointed position: end {} -> {}, slope {} -> {}, globalEpoch={}",
            oldEnd, newEnd, oldSlope, newSlope, tx.globalHistory().epoch());
        return userHistory.record(userPoint);
    }

    /**
     * Replays the aggregate from its last point to now.
     *
     * Intermediate week boundaries are appended to the global history, with
     * block references interpolated between the last point and now. The point
     * at now is returned, not recorded.
     */
    private GlobalPoint advanceGlobal(LedgerTransaction tx) {
        long now = tx.now();
        long block = tx.block();
        CheckpointHistory<GlobalPoint> history = tx.globalHistory();
        GlobalPoint last = history.isEmpty() ? GlobalPoint.origin(now, block) : history.last();

        BigInteger bias = last.getBias();
        BigInteger slope = last.getSlope();
        long lastCheckpoint = last.getTimestamp();
        long initialTimestamp = last.getTimestamp();
        long initialBlock = last.getBlock();

        BigInteger blockSlope = BigInteger.ZERO;
        if (now > initialTimestamp) {
            blockSlope = Wad.scale(BigInteger.valueOf(block - initialBlock))
                .divide(BigInteger.valueOf(now - initialTimestamp));
        }

        long weekCursor = lastCheckpoint;
        int appended = 0;
        while (true) {
            weekCursor = EpochTime.nextWeek(weekCursor);
            BigInteger scheduled = BigInteger.ZERO;
            if (weekCursor > now) {
                weekCursor = now;
            } else {
                scheduled = tx.slopeChange(weekCursor);
            }
            bias = bias.subtract(slope.multiply(BigInteger.valueOf(weekCursor - lastCheckpoint)));
            slope = slope.add(scheduled);
            bias = SafeCast.toInt256(clampNonNegative(bias));
            slope = SafeCast.toInt256(clampNonNegative(slope));
            lastCheckpoint = weekCursor;

            if (weekCursor == now) {
                break;
            }
            long interpolatedBlock = initialBlock + blockSlope
                .multiply(BigInteger.valueOf(weekCursor - initialTimestamp))
                .divide(Wad.WAD)
                .longValueExact();
            tx.appendGlobalPoint(new GlobalPoint(bias, slope, weekCursor, interpolatedBlock,
                last.getPermanentLockBalance()));
            appended++;
        }
        if (appended > 0) {
            log.debug("Replayed global aggregate over {} week boundaries", appended);
        }
        return new GlobalPoint(bias, slope, now, block, last.getPermanentLockBalance());
    }

    private static BigInteger clampNonNegative(BigInteger value) {
        return value.signum() < 0 ? BigInteger.ZERO : value;
    }
}
