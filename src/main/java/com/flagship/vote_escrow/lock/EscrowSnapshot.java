package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.checkpoint.GlobalState;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One committed state of the ledger: the global aggregate and every position.
 *
 * Snapshots are immutable. A commit builds the next snapshot from the previous
 * one and publishes it with a single reference swap.
 */
@Value
public class EscrowSnapshot {
    GlobalState global;
    Map<Long, PositionRecord> positions;

    static EscrowSnapshot genesis() {
        return new EscrowSnapshot(GlobalState.genesis(), Collections.emptyMap());
    }

    public Optional<PositionRecord> findPosition(long id) {
        return Optional.ofNullable(positions.get(id));
    }

    public Collection<PositionRecord> allPositions() {
        return positions.values();
    }

    EscrowSnapshot next(GlobalState nextGlobal, Collection<PositionRecord> changed) {
        if (changed.isEmpty()) {
            return new EscrowSnapshot(nextGlobal, positions);
        }
        Map<Long, PositionRecord> nextPositions = new HashMap<>(positions);
        for (PositionRecord record : changed) {
            nextPositions.put(record.getId(), record);
        }
        return new EscrowSnapshot(nextGlobal, Collections.unmodifiableMap(nextPositions));
    }
}
