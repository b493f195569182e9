package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.balance.BalanceCalculator;
import com.flagship.vote_escrow.balance.SupplyReplayException;
import com.flagship.vote_escrow.checkpoint.CheckpointHistory;
import com.flagship.vote_escrow.checkpoint.GlobalPoint;
import com.flagship.vote_escrow.checkpoint.GlobalState;
import com.flagship.vote_escrow.checkpoint.UserPoint;
import com.flagship.vote_escrow.time.LedgerClock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read interface of the escrow.
 *
 * Queries never take the writer lock; each one works on a single committed
 * snapshot (one position record or one global state).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LockQueryService {

    private final EscrowStore store;
    private final LedgerClock clock;

    public BigInteger balanceOf(long positionId) {
        return balanceAt(positionId, clock.currentTimestamp());
    }

    /**
     * Balance of a position at a past or present timestamp; 0 for unknown positions.
     */
    public BigInteger balanceAt(long positionId, long timestamp) {
        return store.findPosition(positionId)
            .map(record -> BalanceCalculator.balanceAt(record.getHistory(), timestamp))
            .orElse(BigInteger.ZERO);
    }

    public BigInteger totalSupply() {
        return totalSupplyAt(clock.currentTimestamp());
    }

    public BigInteger totalSupplyAt(long timestamp) {
        GlobalState state = store.global();
        try {
            return BalanceCalculator.supplyAt(state, timestamp);
        } catch (SupplyReplayException e) {
            log.warn("Supply query out of replay range: {}", e.getMessage());
            throw new LockException(LockErrorCode.REPLAY_LIMIT_EXCEEDED, e.getMessage());
        }
    }

    public PositionRecord position(long positionId) {
        return store.findPosition(positionId)
            .orElseThrow(() -> LockException.of(LockErrorCode.NON_EXISTENT, "id=%d", positionId));
    }

    /**
     * Current lock of a position; the empty lock once withdrawn.
     */
    public LockedBalance locked(long positionId) {
        return position(positionId).getLocked();
    }

    public UUID ownerOf(long positionId) {
        PositionRecord record = position(positionId);
        if (record.isWithdrawn()) {
            throw LockException.of(LockErrorCode.NON_EXISTENT, "id=%d is burned", positionId);
        }
        return record.getOwner();
    }

    public List<PositionRecord> positionsOf(UUID owner) {
        return store.allPositions().stream()
            .filter(record -> !record.isWithdrawn() && record.getOwner().equals(owner))
            .sorted(Comparator.comparingLong(PositionRecord::getId))
            .collect(Collectors.toList());
    }

    public long effectiveStart(long positionId) {
        return position(positionId).getEffectiveStart();
    }

    public int epoch() {
        return store.global().getHistory().epoch();
    }

    public GlobalPoint pointHistory(int epoch) {
        CheckpointHistory<GlobalPoint> history = store.global().getHistory();
        requireEpoch(epoch, history.epoch());
        return history.get(epoch);
    }

    public int userPointEpoch(long positionId) {
        return store.findPosition(positionId)
            .map(record -> record.getHistory().epoch())
            .orElse(0);
    }

    public UserPoint userPointHistory(long positionId, int epoch) {
        CheckpointHistory<UserPoint> history = position(positionId).getHistory();
        requireEpoch(epoch, history.epoch());
        return history.get(epoch);
    }

    public BigInteger slopeChange(long timestamp) {
        return store.global().getSchedule().changeAt(timestamp);
    }

    public BigInteger permanentLockBalance() {
        return store.global().getPermanentLockBalance();
    }

    public int positionCount() {
        return store.allPositions().size();
    }

    private static void requireEpoch(int epoch, int latest) {
        if (epoch < 1 || epoch > latest) {
            throw new IllegalArgumentException("Epoch " + epoch + " outside [1, " + latest + "]");
        }
    }
}
