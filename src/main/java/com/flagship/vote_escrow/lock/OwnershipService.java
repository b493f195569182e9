package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.event.PositionTransferredEvent;
import com.flagship.vote_escrow.observability.EscrowMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Ownership and delegation of positions.
 *
 * A position has one owner and at most one approved delegate; an owner may also
 * name operators that act on all of its positions. Transfers clear the delegate.
 * Balances and checkpoints are unaffected by ownership changes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OwnershipService {

    private final EscrowStore store;
    private final EscrowMetrics metrics;

    /**
     * Sets (or with {@code null} clears) the approved delegate of a position.
     * Allowed for the owner and the owner's operators.
     */
    public void approve(UUID caller, long positionId, UUID approved) {
        LockService.requireHolder(caller);
        store.write(tx -> {
            PositionRecord record = tx.livePosition(positionId);
            UUID owner = record.getOwner();
            if (!caller.equals(owner) && !store.isApprovedForAll(owner, caller)) {
                throw LockException.of(LockErrorCode.NOT_APPROVED_OR_OWNER, "caller=%s, id=%d", caller, positionId);
            }
            tx.put(record.toBuilder().approved(approved).build());
            return null;
        });
        metrics.recordOperation("approve", "success");
        log.info("Approval set: positionId={}, approved={}", positionId, approved);
    }

    public void setApprovalForAll(UUID owner, UUID operator, boolean approved) {
        LockService.requireHolder(owner);
        LockService.requireHolder(operator);
        if (owner.equals(operator)) {
            throw new IllegalArgumentException("Owner cannot be its own operator");
        }
        store.exclusive(() -> store.setApprovalForAll(owner, operator, approved));
        log.info("Operator approval changed: owner={}, operator={}, approved={}", owner, operator, approved);
    }

    /**
     * Moves a live position from {@code from} to {@code to}.
     */
    public void transferFrom(UUID caller, UUID from, UUID to, long positionId) {
        LockService.requireHolder(caller);
        LockService.requireHolder(to);
        store.write(tx -> {
            PositionRecord record = tx.livePosition(positionId);
            if (!record.getOwner().equals(from)) {
                throw LockException.of(LockErrorCode.NOT_APPROVED_OR_OWNER,
                    "id=%d is not owned by %s", positionId, from);
            }
            if (!store.isApprovedOrOwner(caller, record)) {
                throw LockException.of(LockErrorCode.NOT_APPROVED_OR_OWNER, "caller=%s, id=%d", caller, positionId);
            }
            tx.put(record.transferTo(to));
            tx.emit(PositionTransferredEvent.of(positionId, from, to, tx.now()));
            return null;
        });
        metrics.recordOperation("transfer", "success");
        log.info("Position transferred: positionId={}, from={}, to={}", positionId, from, to);
    }

    public boolean isApprovedOrOwner(UUID caller, long positionId) {
        return store.findPosition(positionId)
            .filter(record -> !record.isWithdrawn())
            .map(record -> store.isApprovedOrOwner(caller, record))
            .orElse(false);
    }
}
