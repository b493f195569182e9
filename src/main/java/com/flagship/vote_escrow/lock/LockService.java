package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.balance.SafeCast;
import com.flagship.vote_escrow.checkpoint.CheckpointHistory;
import com.flagship.vote_escrow.checkpoint.UserPoint;
import com.flagship.vote_escrow.event.DepositType;
import com.flagship.vote_escrow.event.LockDepositedEvent;
import com.flagship.vote_escrow.event.LockPermanenceChangedEvent;
import com.flagship.vote_escrow.event.LockSplitEvent;
import com.flagship.vote_escrow.event.LockWithdrawnEvent;
import com.flagship.vote_escrow.event.LocksMergedEvent;
import com.flagship.vote_escrow.observability.CorrelationContext;
import com.flagship.vote_escrow.observability.EscrowMetrics;
import com.flagship.vote_escrow.time.EpochTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Lock lifecycle manager.
 *
 * State machine per position:
 * - ACTIVE → ACTIVE (deposit, increase amount, extend unlock time)
 * - ACTIVE ↔ PERMANENT (lock permanent / unlock permanent)
 * - ACTIVE / PERMANENT → WITHDRAWN (merge away, split, withdraw, early withdraw)
 * - WITHDRAWN is terminal
 *
 * Every transition runs as one {@link LedgerTransaction}: the position's old
 * contribution is removed from the aggregate, the new one is added, a user
 * checkpoint and a global checkpoint are written and the slope schedule is
 * updated. Token movements are staged on the transaction and carried out by
 * the commit, so a rejected transfer leaves no trace.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LockService {

    private final EscrowStore store;
    private final CheckpointWriter checkpointWriter;
    private final LockPolicy policy;
    private final EscrowGovernance governance;
    private final EscrowMetrics metrics;

    /**
     * Locks tokens of the caller in a new position owned by the caller.
     *
     * @return id of the new position
     */
    public long createLock(UUID caller, BigInteger amount, long duration) {
        return createLockFor(caller, amount, duration, caller);
    }

    /**
     * Locks tokens of the caller in a new position owned by {@code recipient}.
     *
     * The unlock time is {@code now + duration} rounded down to a week boundary
     * and must lie within [minimum, maximum] lock duration from now.
     *
     * @return id of the new position
     */
    public long createLockFor(UUID caller, BigInteger amount, long duration, UUID recipient) {
        requireHolder(caller);
        requireHolder(recipient);
        requireDepositAmount(amount);

        PositionRecord created = execute("create_lock", null, () -> store.write(tx -> {
            long now = tx.now();
            long unlockTime = newUnlockTime(now, duration);
            if (unlockTime - now < policy.getMinDuration() || unlockTime <= now) {
                throw LockException.of(LockErrorCode.LOCK_TOO_SHORT, "unlockTime=%d, now=%d", unlockTime, now);
            }

            LockedBalance locked = LockedBalance.decaying(amount, unlockTime);
            long id = tx.nextPositionId();
            CheckpointHistory<UserPoint> history =
                checkpointWriter.checkpoint(tx, CheckpointHistory.empty(), LockedBalance.EMPTY, locked);
            PositionRecord record = PositionRecord.mint(id, recipient, locked, now, history);
            tx.put(record);
            tx.emit(LockDepositedEvent.of(id, recipient, caller, amount, amount, unlockTime,
                DepositType.CREATE_LOCK, now));

            tx.pullTokens(caller, amount);
            return record;
        }));

        metrics.recordTokensLocked(amount.doubleValue());
        log.info("Lock created: positionId={}, owner={}, amount={}, unlockTime={}",
            created.getId(), recipient, amount, created.getLocked().getEnd());
        return created.getId();
    }

    /**
     * Adds tokens of the caller to any live position; no ownership required.
     */
    public LockedBalance depositFor(UUID caller, long positionId, BigInteger amount) {
        return increase(caller, positionId, amount, DepositType.DEPOSIT_FOR);
    }

    /**
     * Adds tokens of the caller to a position the caller owns or is approved for.
     */
    public LockedBalance increaseAmount(UUID caller, long positionId, BigInteger amount) {
        return increase(caller, positionId, amount, DepositType.INCREASE_AMOUNT);
    }

    private LockedBalance increase(UUID caller, long positionId, BigInteger amount, DepositType type) {
        requireHolder(caller);
        requireDepositAmount(amount);

        LockedBalance updated = execute(type.name().toLowerCase(), positionId, () -> store.write(tx -> {
            PositionRecord record = tx.livePosition(positionId);
            if (type == DepositType.INCREASE_AMOUNT) {
                requireApprovedOrOwner(caller, record);
            }
            LockedBalance old = record.getLocked();
            long now = tx.now();
            if (!old.isPermanent()) {
                if (old.isExpired(now)) {
                    throw LockException.of(LockErrorCode.EXPIRED, "id=%d, end=%d", positionId, old.getEnd());
                }
                // at least the minimum lock duration must remain
                if (old.getEnd() - now < policy.getMinDuration()) {
                    throw LockException.of(LockErrorCode.DEPOSIT_DURATION_TOO_SHORT,
                        "id=%d, remaining=%ds", positionId, old.getEnd() - now);
                }
            }

            LockedBalance newLocked = old.withAmount(SafeCast.toUint256(old.getAmount().add(amount)));
            long newStart = weightedStart(old.getAmount(), record.getEffectiveStart(), amount, now);
            CheckpointHistory<UserPoint> history =
                checkpointWriter.checkpoint(tx, record.getHistory(), old, newLocked);
            tx.put(record.relock(newLocked, history).toBuilder().effectiveStart(newStart).build());
            tx.emit(LockDepositedEvent.of(positionId, record.getOwner(), caller, amount, newLocked.getAmount(),
                newLocked.getVisibleEnd(), type, now));

            tx.pullTokens(caller, amount);
            return newLocked;
        }));

        metrics.recordTokensLocked(amount.doubleValue());
        log.info("Lock increased: positionId={}, depositor={}, amount={}, lockedAmount={}",
            positionId, caller, amount, updated.getAmount());
        return updated;
    }

    /**
     * Moves the unlock time of a decaying position forward.
     */
    public LockedBalance increaseUnlockTime(UUID caller, long positionId, long duration) {
        requireHolder(caller);

        LockedBalance updated = execute("increase_unlock_time", positionId, () -> store.write(tx -> {
            PositionRecord record = tx.livePosition(positionId);
            requireApprovedOrOwner(caller, record);
            LockedBalance old = record.getLocked();
            long now = tx.now();
            if (old.isPermanent()) {
                throw LockException.of(LockErrorCode.ALREADY_PERMANENT, "id=%d", positionId);
            }
            if (old.isExpired(now)) {
                throw LockException.of(LockErrorCode.EXPIRED, "id=%d, end=%d", positionId, old.getEnd());
            }
            long unlockTime = newUnlockTime(now, duration);
            if (unlockTime <= old.getEnd()) {
                throw LockException.of(LockErrorCode.UNLOCK_TIME_NOT_LATER,
                    "current=%d, requested=%d", old.getEnd(), unlockTime);
            }

            LockedBalance newLocked = old.withEnd(unlockTime);
            CheckpointHistory<UserPoint> history =
                checkpointWriter.checkpoint(tx, record.getHistory(), old, newLocked);
            tx.put(record.relock(newLocked, history));
            tx.emit(LockDepositedEvent.of(positionId, record.getOwner(), caller, BigInteger.ZERO,
                newLocked.getAmount(), unlockTime, DepositType.INCREASE_UNLOCK_TIME, now));
            return newLocked;
        }));

        log.info("Lock extended: positionId={}, unlockTime={}", positionId, updated.getEnd());
        return updated;
    }

    /**
     * Freezes a position's weight at its amount.
     *
     * The scheduled expiry is cancelled but the unlock time is retained, so
     * {@link #unlockPermanent} resumes the original decay curve.
     */
    public void lockPermanent(UUID caller, long positionId) {
        requireHolder(caller);

        LockedBalance locked = execute("lock_permanent", positionId, () -> store.write(tx -> {
            PositionRecord record = tx.livePosition(positionId);
            requireApprovedOrOwner(caller, record);
            LockedBalance old = record.getLocked();
            if (old.isPermanent()) {
                throw LockException.of(LockErrorCode.ALREADY_PERMANENT, "id=%d", positionId);
            }
            if (old.isExpired(tx.now())) {
                throw LockException.of(LockErrorCode.EXPIRED, "id=%d, end=%d", positionId, old.getEnd());
            }

            LockedBalance newLocked = old.toPermanent();
            CheckpointHistory<UserPoint> history =
                checkpointWriter.checkpoint(tx, record.getHistory(), old, newLocked);
            tx.put(record.relock(newLocked, history));
            tx.emit(LockPermanenceChangedEvent.of(positionId, record.getOwner(), newLocked.getAmount(), true,
                0L, tx.now()));
            return newLocked;
        }));

        log.info("Lock made permanent: positionId={}, amount={}, retainedEnd={}",
            positionId, locked.getAmount(), locked.getEnd());
    }

    /**
     * Converts a permanent position back to a decaying one at its retained unlock time.
     *
     * The weight is {@code slope * (unlockTime - now)}, as if it had been
     * decaying all along. A retained unlock time already in the past yields an
     * expired position that can be withdrawn.
     */
    public void unlockPermanent(UUID caller, long positionId) {
        requireHolder(caller);

        LockedBalance unlocked = execute("unlock_permanent", positionId, () -> store.write(tx -> {
            PositionRecord record = tx.livePosition(positionId);
            requireApprovedOrOwner(caller, record);
            LockedBalance old = record.getLocked();
            if (!old.isPermanent()) {
                throw LockException.of(LockErrorCode.NOT_PERMANENT, "id=%d", positionId);
            }

            LockedBalance newLocked = old.toDecaying();
            CheckpointHistory<UserPoint> history =
                checkpointWriter.checkpoint(tx, record.getHistory(), old, newLocked);
            tx.put(record.relock(newLocked, history));
            tx.emit(LockPermanenceChangedEvent.of(positionId, record.getOwner(), newLocked.getAmount(), false,
                newLocked.getEnd(), tx.now()));
            return newLocked;
        }));

        log.info("Lock unlocked from permanent: positionId={}, amount={}, unlockTime={}",
            positionId, unlocked.getAmount(), unlocked.getEnd());
    }

    /**
     * Merges {@code fromId} into {@code toId}; {@code fromId} is withdrawn.
     *
     * The result unlocks at the later of both unlock times, or stays permanent
     * if {@code toId} is permanent.
     */
    public LockedBalance merge(UUID caller, long fromId, long toId) {
        requireHolder(caller);
        if (fromId == toId) {
            throw LockException.of(LockErrorCode.SAME_POSITION, "id=%d", fromId);
        }

        LockedBalance merged = execute("merge", toId, () -> store.write(tx -> {
            PositionRecord from = tx.livePosition(fromId);
            PositionRecord to = tx.livePosition(toId);
            requireApprovedOrOwner(caller, from);
            requireApprovedOrOwner(caller, to);
            LockedBalance oldFrom = from.getLocked();
            LockedBalance oldTo = to.getLocked();
            long now = tx.now();
            if (oldTo.isExpired(now)) {
                throw LockException.of(LockErrorCode.EXPIRED, "id=%d, end=%d", toId, oldTo.getEnd());
            }
            if (oldFrom.isPermanent()) {
                throw LockException.of(LockErrorCode.ALREADY_PERMANENT, "id=%d", fromId);
            }

            CheckpointHistory<UserPoint> fromHistory =
                checkpointWriter.checkpoint(tx, from.getHistory(), oldFrom, LockedBalance.EMPTY);
            tx.put(from.burn(fromHistory));

            long end = Math.max(oldFrom.getEnd(), oldTo.getEnd());
            BigInteger total = SafeCast.toUint256(oldFrom.getAmount().add(oldTo.getAmount()));
            LockedBalance newTo = new LockedBalance(total, end, oldTo.isPermanent());
            long newStart = weightedStart(oldTo.getAmount(), to.getEffectiveStart(),
                oldFrom.getAmount(), from.getEffectiveStart());
            CheckpointHistory<UserPoint> toHistory =
                checkpointWriter.checkpoint(tx, to.getHistory(), oldTo, newTo);
            tx.put(to.relock(newTo, toHistory).toBuilder().effectiveStart(newStart).build());

            tx.emit(new LocksMergedEvent(UUID.randomUUID(), toId, fromId, caller, oldFrom.getAmount(),
                oldTo.getAmount(), total, newTo.getVisibleEnd(), newTo.isPermanent(), Instant.ofEpochSecond(now)));
            return newTo;
        }));

        log.info("Locks merged: from={}, to={}, amount={}, unlockTime={}, permanent={}",
            fromId, toId, merged.getAmount(), merged.getVisibleEnd(), merged.isPermanent());
        return merged;
    }

    /**
     * Splits {@code amount} off a position into a new one.
     *
     * The source is withdrawn and two positions are minted to its owner with the
     * same unlock time and permanence: the first with {@code total - amount},
     * the second with {@code amount}.
     */
    public SplitResult split(UUID caller, long positionId, BigInteger amount) {
        requireHolder(caller);

        SplitResult result = execute("split", positionId, () -> store.write(tx -> {
            PositionRecord record = tx.livePosition(positionId);
            UUID owner = record.getOwner();
            if (!governance.canSplit(owner)) {
                throw LockException.of(LockErrorCode.SPLIT_NOT_ALLOWED, "owner=%s", owner);
            }
            requireApprovedOrOwner(caller, record);
            LockedBalance source = record.getLocked();
            long now = tx.now();
            if (source.isExpired(now)) {
                throw LockException.of(LockErrorCode.EXPIRED, "id=%d, end=%d", positionId, source.getEnd());
            }
            if (amount == null || amount.signum() <= 0) {
                throw new LockException(LockErrorCode.ZERO_AMOUNT);
            }
            if (amount.compareTo(source.getAmount()) >= 0) {
                throw LockException.of(LockErrorCode.AMOUNT_TOO_LARGE, "amount=%s, locked=%s",
                    amount, source.getAmount());
            }

            CheckpointHistory<UserPoint> burned =
                checkpointWriter.checkpoint(tx, record.getHistory(), source, LockedBalance.EMPTY);
            tx.put(record.burn(burned));

            LockedBalance first = source.withAmount(source.getAmount().subtract(amount));
            LockedBalance second = source.withAmount(amount);
            long firstId = mintSplit(tx, owner, first, record.getEffectiveStart());
            long secondId = mintSplit(tx, owner, second, record.getEffectiveStart());

            tx.emit(new LockSplitEvent(UUID.randomUUID(), positionId, firstId, secondId, caller,
                first.getAmount(), second.getAmount(), source.getVisibleEnd(), source.isPermanent(),
                Instant.ofEpochSecond(now)));
            return new SplitResult(firstId, secondId, first.getAmount(), second.getAmount());
        }));

        log.info("Lock split: positionId={}, first={} ({}), second={} ({})", positionId,
            result.getFirstId(), result.getFirstAmount(), result.getSecondId(), result.getSecondAmount());
        return result;
    }

    private long mintSplit(LedgerTransaction tx, UUID owner, LockedBalance locked, long effectiveStart) {
        long id = tx.nextPositionId();
        CheckpointHistory<UserPoint> history =
            checkpointWriter.checkpoint(tx, CheckpointHistory.empty(), LockedBalance.EMPTY, locked);
        tx.put(PositionRecord.mint(id, owner, locked, effectiveStart, history));
        tx.emit(LockDepositedEvent.of(id, owner, owner, locked.getAmount(), locked.getAmount(),
            locked.getVisibleEnd(), DepositType.SPLIT, tx.now()));
        return id;
    }

    /**
     * Withdraws an expired decaying position; the full amount goes to the caller.
     *
     * @return the withdrawn amount
     */
    public BigInteger withdraw(UUID caller, long positionId) {
        requireHolder(caller);

        BigInteger withdrawn = execute("withdraw", positionId, () -> store.write(tx -> {
            PositionRecord record = tx.livePosition(positionId);
            requireApprovedOrOwner(caller, record);
            LockedBalance old = record.getLocked();
            if (old.isPermanent()) {
                throw LockException.of(LockErrorCode.ALREADY_PERMANENT, "id=%d", positionId);
            }
            if (tx.now() < old.getEnd()) {
                throw LockException.of(LockErrorCode.NOT_EXPIRED, "id=%d, end=%d", positionId, old.getEnd());
            }

            CheckpointHistory<UserPoint> history =
                checkpointWriter.checkpoint(tx, record.getHistory(), old, LockedBalance.EMPTY);
            tx.put(record.burn(history));
            tx.emit(LockWithdrawnEvent.atExpiry(positionId, caller, old.getAmount(), tx.now()));

            tx.pushTokens(caller, old.getAmount());
            return old.getAmount();
        }));

        metrics.recordTokensReleased(withdrawn.doubleValue());
        log.info("Lock withdrawn: positionId={}, amount={}", positionId, withdrawn);
        return withdrawn;
    }

    /**
     * Withdraws a decaying position before its unlock time, paying a penalty.
     *
     * {@code penalty = amount * maxPenaltyBps * (unlockTime - now) / (10000 * (unlockTime - effectiveStart))}.
     * The penalty goes to the treasury and the rest to the caller.
     */
    public EarlyWithdrawal earlyWithdraw(UUID caller, long positionId) {
        requireHolder(caller);

        EarlyWithdrawal withdrawal = execute("early_withdraw", positionId, () -> store.write(tx -> {
            PositionRecord record = tx.livePosition(positionId);
            requireApprovedOrOwner(caller, record);
            LockedBalance old = record.getLocked();
            long now = tx.now();
            if (old.isPermanent()) {
                throw LockException.of(LockErrorCode.ALREADY_PERMANENT, "id=%d", positionId);
            }
            if (old.isExpired(now)) {
                throw LockException.of(LockErrorCode.EXPIRED, "id=%d, end=%d", positionId, old.getEnd());
            }
            UUID treasury = governance.getEarlyWithdrawTreasury();
            if (treasury == null) {
                throw new LockException(LockErrorCode.TREASURY_NOT_SET);
            }

            BigInteger penalty = earlyWithdrawPenalty(old, record.getEffectiveStart(), now,
                governance.getEarlyWithdrawPenaltyBps());
            BigInteger payout = old.getAmount().subtract(penalty);

            CheckpointHistory<UserPoint> history =
                checkpointWriter.checkpoint(tx, record.getHistory(), old, LockedBalance.EMPTY);
            tx.put(record.burn(history));
            tx.emit(LockWithdrawnEvent.early(positionId, caller, old.getAmount(), penalty, treasury, now));

            tx.pushTokens(caller, payout);
            if (penalty.signum() > 0) {
                tx.pushTokens(treasury, penalty);
            }
            return new EarlyWithdrawal(positionId, old.getAmount(), penalty, payout, treasury);
        }));

        metrics.recordTokensReleased(withdrawal.getAmount().doubleValue());
        metrics.recordPenalty(withdrawal.getPenalty().doubleValue());
        log.info("Lock withdrawn early: positionId={}, amount={}, penalty={}, payout={}",
            positionId, withdrawal.getAmount(), withdrawal.getPenalty(), withdrawal.getPayout());
        return withdrawal;
    }

    /**
     * Advances the global aggregate to now without changing any position.
     */
    public void checkpoint() {
        execute("checkpoint", null, () -> store.write(tx -> {
            checkpointWriter.checkpointGlobal(tx);
            return null;
        }));
    }

    static BigInteger earlyWithdrawPenalty(LockedBalance locked, long effectiveStart, long now, int maxPenaltyBps) {
        long totalLockTime = locked.getEnd() - effectiveStart;
        long remainingTime = locked.getEnd() - now;
        if (totalLockTime <= 0 || remainingTime <= 0) {
            return BigInteger.ZERO;
        }
        return locked.getAmount()
            .multiply(BigInteger.valueOf(maxPenaltyBps))
            .multiply(BigInteger.valueOf(remainingTime))
            .divide(BigInteger.valueOf(EscrowGovernance.BASIS_POINTS).multiply(BigInteger.valueOf(totalLockTime)));
    }

    /**
     * Amount-weighted average of two start times, rounded down.
     */
    static long weightedStart(BigInteger amountA, long startA, BigInteger amountB, long startB) {
        BigInteger total = amountA.add(amountB);
        if (total.signum() == 0) {
            return Math.max(startA, startB);
        }
        return amountA.multiply(BigInteger.valueOf(startA))
            .add(amountB.multiply(BigInteger.valueOf(startB)))
            .divide(total)
            .longValueExact();
    }

    private long newUnlockTime(long now, long duration) {
        // also keeps now + duration from overflowing
        if (duration > policy.getMaxDuration() + EpochTime.WEEK) {
            throw LockException.of(LockErrorCode.LOCK_TOO_LONG, "duration=%d", duration);
        }
        long unlockTime = EpochTime.weekStart(now + duration);
        if (unlockTime > now + policy.getMaxDuration()) {
            throw LockException.of(LockErrorCode.LOCK_TOO_LONG, "unlockTime=%d, now=%d", unlockTime, now);
        }
        return unlockTime;
    }

    private void requireDepositAmount(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LockException(LockErrorCode.ZERO_AMOUNT);
        }
        SafeCast.toUint256(amount);
        if (amount.compareTo(governance.getMinLockAmount()) < 0) {
            throw LockException.of(LockErrorCode.AMOUNT_TOO_SMALL, "amount=%s, minimum=%s",
                amount, governance.getMinLockAmount());
        }
    }

    private void requireApprovedOrOwner(UUID caller, PositionRecord record) {
        if (!store.isApprovedOrOwner(caller, record)) {
            throw LockException.of(LockErrorCode.NOT_APPROVED_OR_OWNER, "caller=%s, id=%d", caller, record.getId());
        }
    }

    static void requireHolder(UUID holder) {
        if (holder == null) {
            throw new LockException(LockErrorCode.ZERO_ADDRESS);
        }
    }

    private <T> T execute(String operation, Long positionId, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        if (positionId != null) {
            MDC.put(CorrelationContext.POSITION_ID_MDC_KEY, positionId.toString());
        }
        try {
            T result = action.get();
            metrics.recordOperation(operation, "success");
            return result;
        } catch (LockException e) {
            metrics.recordOperation(operation, e.getCode().name().toLowerCase());
            log.warn("Lock operation rejected: operation={}, code={}, message={}",
                operation, e.getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOperation(operation, "error");
            log.error("Lock operation failed: operation={}, error={}", operation, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            if (positionId != null) {
                MDC.remove(CorrelationContext.POSITION_ID_MDC_KEY);
            }
        }
    }
}
