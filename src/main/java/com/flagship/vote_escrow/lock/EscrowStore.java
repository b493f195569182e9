package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.checkpoint.CheckpointHistory;
import com.flagship.vote_escrow.checkpoint.GlobalPoint;
import com.flagship.vote_escrow.checkpoint.GlobalState;
import com.flagship.vote_escrow.outbox.OutboxEvent;
import com.flagship.vote_escrow.outbox.OutboxService;
import com.flagship.vote_escrow.time.LedgerClock;
import com.flagship.vote_escrow.token.TokenVault;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Arena of positions plus the global checkpoint state.
 *
 * Writers are serialized by a single lock and work on a {@link LedgerTransaction};
 * only a transaction that completes is committed. Readers take no lock: positions
 * and the global state live in one immutable {@link EscrowSnapshot} behind a
 * volatile reference, so a read sees either the state before a commit or after it.
 *
 * Commit order:
 * 1. Serialize the transaction's events (may fail, nothing has happened yet)
 * 2. Carry out its token movements (a failure reverts the ones already done)
 * 3. Publish the next snapshot
 * 4. Append the events to the outbox
 */
@Component
@Slf4j
public class EscrowStore {

    private final LedgerClock clock;
    private final OutboxService outboxService;
    private final TokenVault tokenVault;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final ConcurrentMap<UUID, Set<UUID>> operatorApprovals = new ConcurrentHashMap<>();
    private volatile EscrowSnapshot snapshot = EscrowSnapshot.genesis();

    public EscrowStore(LedgerClock clock, OutboxService outboxService, TokenVault tokenVault) {
        this.clock = clock;
        this.outboxService = outboxService;
        this.tokenVault = tokenVault;
    }

    /**
     * Runs a lock operation against a fresh transaction and commits it atomically.
     *
     * The transaction time never goes back past the latest global checkpoint; a
     * clock that steps backwards is held at that checkpoint.
     */
    public <T> T write(Function<LedgerTransaction, T> operation) {
        writeLock.lock();
        try {
            EscrowSnapshot base = snapshot;
            long now = clock.currentTimestamp();
            long block = clock.currentBlock();
            CheckpointHistory<GlobalPoint> history = base.getGlobal().getHistory();
            if (!history.isEmpty()) {
                GlobalPoint last = history.last();
                if (now < last.getTimestamp()) {
                    log.warn("Clock is behind the latest checkpoint: clock={}, checkpoint={}",
                        now, last.getTimestamp());
                    now = last.getTimestamp();
                }
                block = Math.max(block, last.getBlock());
            }

            LedgerTransaction tx = new LedgerTransaction(base, now, block);
            T result = operation.apply(tx);
            commit(base, tx);
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Runs a state change that is not a checkpointed transition (governance,
     * approvals) under the writer lock.
     */
    public void exclusive(Runnable change) {
        writeLock.lock();
        try {
            change.run();
        } finally {
            writeLock.unlock();
        }
    }

    private void commit(EscrowSnapshot base, LedgerTransaction tx) {
        List<OutboxEvent> prepared = outboxService.prepareEvents(tx.events());
        moveTokens(tx.custodyMoves());

        EscrowSnapshot next = base.next(tx.toGlobalState(), tx.stagedPositions());
        snapshot = next;
        outboxService.enqueue(prepared);

        log.debug("Committed transaction: positions={}, globalEpoch={}, events={}",
            tx.stagedPositions().size(), next.getGlobal().getHistory().epoch(), prepared.size());
    }

    private void moveTokens(List<CustodyMove> moves) {
        List<CustodyMove> done = new ArrayList<>(moves.size());
        try {
            for (CustodyMove move : moves) {
                move.applyTo(tokenVault);
                done.add(move);
            }
        } catch (RuntimeException e) {
            for (int i = done.size() - 1; i >= 0; i--) {
                CustodyMove move = done.get(i);
                try {
                    move.revertOn(tokenVault);
                } catch (RuntimeException revertFailure) {
                    log.error("Failed to revert token movement: {}", move, revertFailure);
                    e.addSuppressed(revertFailure);
                }
            }
            throw e;
        }
    }

    /**
     * Latest committed state; positions and aggregate read from it are consistent
     * with each other.
     */
    public EscrowSnapshot snapshot() {
        return snapshot;
    }

    public GlobalState global() {
        return snapshot.getGlobal();
    }

    public Optional<PositionRecord> findPosition(long id) {
        return snapshot.findPosition(id);
    }

    public Collection<PositionRecord> allPositions() {
        return snapshot.allPositions();
    }

    public boolean isApprovedForAll(UUID owner, UUID operator) {
        Set<UUID> operators = operatorApprovals.get(owner);
        return operators != null && operators.contains(operator);
    }
    void setApprovalForAll(UUID owner, UUID operator, boolean approved) {
        if (approved) {
            operatorApprovals.computeIfAbsent(owner, key -> ConcurrentHashMap.newKeySet()).add(operator);
        } else {
            Set<UUID> operators = operatorApprovals.get(owner);
            if (operators != null) {
                operators.remove(operator);
            }
        }
    }

    public boolean isApprovedOrOwner(UUID caller, PositionRecord record) {
        if (caller == null) {
            return false;
        }
        return caller.equals(record.getOwner())
            || caller.equals(record.getApproved())
            || isApprovedForAll(record.getOwner(), caller);
    }
}
