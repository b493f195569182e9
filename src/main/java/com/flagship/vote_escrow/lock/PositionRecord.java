package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.checkpoint.CheckpointHistory;
import com.flagship.vote_escrow.checkpoint.UserPoint;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Immutable state of one position: lock, ownership and checkpoint history.
 *
 * Every change produces a new record, so a reader holding a record always sees
 * a lock and a history that belong together.
 */
@Value
@Builder(toBuilder = true)
public class PositionRecord {
    long id;
    UUID owner;
    UUID approved;
    LockedBalance locked;
    long effectiveStart;
    CheckpointHistory<UserPoint> history;
    boolean withdrawn;

    public static PositionRecord mint(long id, UUID owner, LockedBalance locked, long effectiveStart,
                                      CheckpointHistory<UserPoint> history) {
        return PositionRecord.builder()
            .id(id)
            .owner(owner)
            .locked(locked)
            .effectiveStart(effectiveStart)
            .history(history)
            .build();
    }

    public LockStatus getStatus() {
        if (withdrawn) {
            return LockStatus.WITHDRAWN;
        }
        return locked.isPermanent() ? LockStatus.PERMANENT : LockStatus.ACTIVE;
    }

    /**
     * Zeroes the lock and marks the position as burned; ownership and history are kept.
     */
    public PositionRecord burn(CheckpointHistory<UserPoint> finalHistory) {
        return toBuilder()
            .locked(LockedBalance.EMPTY)
            .approved(null)
            .history(finalHistory)
            .withdrawn(true)
            .build();
    }

    public PositionRecord relock(LockedBalance newLocked, CheckpointHistory<UserPoint> newHistory) {
        return toBuilder()
            .locked(newLocked)
            .history(newHistory)
            .build();
    }

    public PositionRecord transferTo(UUID newOwner) {
        return toBuilder()
            .owner(newOwner)
            .approved(null)
            .build();
    }
}
