package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.checkpoint.CheckpointHistory;
import com.flagship.vote_escrow.checkpoint.GlobalPoint;
import com.flagship.vote_escrow.checkpoint.GlobalState;
import com.flagship.vote_escrow.checkpoint.SlopeSchedule;
import com.flagship.vote_escrow.event.LockEvent;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Staged write set for one lock operation.
 *
 * Reads fall through to the snapshot the transaction started from; writes and
 * token movements stay local until {@link EscrowStore} commits them. A
 * transaction that throws is discarded, which rolls back positions, global
 * points and the slope schedule together, and no tokens move.
 * The clock is sampled once, so every checkpoint of one operation shares the
 * same timestamp and block.
 */
public final class LedgerTransaction {

    private final EscrowSnapshot base;
    private final long now;
    private final long block;

    private CheckpointHistory<GlobalPoint> globalHistory;
    private final SlopeSchedule baseSchedule;
    private SlopeSchedule.Builder scheduleBuilder;
    private BigInteger permanentLockBalance;
    private long lastPositionId;

    private final Map<Long, PositionRecord> staged = new LinkedHashMap<>();
    private final List<LockEvent> events = new ArrayList<>();
    private final List<CustodyMove> custodyMoves = new ArrayList<>();

    LedgerTransaction(EscrowSnapshot base, long now, long block) {
        GlobalState global = base.getGlobal();
        this.base = base;
        this.now = now;
        this.block = block;
        this.globalHistory = global.getHistory();
        this.baseSchedule = global.getSchedule();
        this.permanentLockBalance = global.getPermanentLockBalance();
        this.lastPositionId = global.getLastPositionId();
    }

    public long now() {
        return now;
    }

    public long block() {
        return block;
    }

    public Optional<PositionRecord> findPosition(long id) {
        PositionRecord record = staged.get(id);
        return record != null ? Optional.of(record) : base.findPosition(id);
    }

    /**
     * Loads a position that must exist and must not be withdrawn.
     */
    public PositionRecord livePosition(long id) {
        PositionRecord record = findPosition(id)
            .orElseThrow(() -> LockException.of(LockErrorCode.NON_EXISTENT, "id=%d", id));
        if (record.isWithdrawn()) {
            throw LockException.of(LockErrorCode.WITHDRAWN, "id=%d", id);
        }
        return record;
    }

    public void put(PositionRecord record) {
        staged.put(record.getId(), record);
    }

    public long nextPositionId() {
        return ++lastPositionId;
    }

    public CheckpointHistory<GlobalPoint> globalHistory() {
        return globalHistory;
    }

    public void appendGlobalPoint(GlobalPoint point) {
        globalHistory = globalHistory.append(point);
    }

    public void recordGlobalPoint(GlobalPoint point) {
        globalHistory = globalHistory.record(point);
    }

    public BigInteger slopeChange(long timestamp) {
        return scheduleBuilder != null ? scheduleBuilder.changeAt(timestamp) : baseSchedule.changeAt(timestamp);
    }

    public void setSlopeChange(long timestamp, BigInteger delta) {
        if (scheduleBuilder == null) {
            scheduleBuilder = baseSchedule.toBuilder();
        }
        scheduleBuilder.put(timestamp, delta);
    }

    public BigInteger permanentLockBalance() {
        return permanentLockBalance;
    }

    public void adjustPermanentLockBalance(BigInteger delta) {
        permanentLockBalance = permanentLockBalance.add(delta);
    }

    public void emit(LockEvent event) {
        events.add(event);
    }

    /**
     * Stages moving {@code amount} from a holder into custody.
     */
    public void pullTokens(UUID from, BigInteger amount) {
        custodyMoves.add(CustodyMove.pull(from, amount));
    }

    /**
     * Stages releasing {@code amount} from custody to a holder.
     */
    public void pushTokens(UUID to, BigInteger amount) {
        custodyMoves.add(CustodyMove.push(to, amount));
    }

    List<LockEvent> events() {
        return Collections.unmodifiableList(events);
    }

    List<CustodyMove> custodyMoves() {
        return Collections.unmodifiableList(custodyMoves);
    }

    Collection<PositionRecord> stagedPositions() {
        return staged.values();
    }

    GlobalState toGlobalState() {
        SlopeSchedule schedule = scheduleBuilder != null ? scheduleBuilder.build() : baseSchedule;
        return new GlobalState(globalHistory, schedule, permanentLockBalance, lastPositionId);
    }
}
