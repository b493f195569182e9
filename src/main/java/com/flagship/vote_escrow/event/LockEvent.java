package com.flagship.vote_escrow.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for lock lifecycle events.
 *
 * Events are facts about committed transitions. They are written to the outbox
 * in the same commit as the ledger state they describe.
 */
public interface LockEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * The position this event is about.
     */
    long getPositionId();

    /**
     * Ledger time of the transition.
     */
    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
