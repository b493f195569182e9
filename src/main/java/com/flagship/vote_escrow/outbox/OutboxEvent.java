package com.flagship.vote_escrow.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in the outbox to be published to Kafka.
 *
 * Key properties:
 * - Immutable value object
 * - Contains all information needed for publishing
 * - Tracks retry information; published events leave the outbox
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g., "Lock"
    long aggregateId;          // position id
    String eventType;          // e.g., "LockDeposited"
    String payload;            // JSON payload
    Instant createdAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    /**
     * Creates a new unpublished outbox event.
     */
    public static OutboxEvent create(String aggregateType, long aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            0,     // no retries yet
            null,  // no errors yet
            null   // sequence assigned on enqueue
        );
    }

    public OutboxEvent withSequenceNumber(long sequence) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload, createdAt,
            retryCount, lastError, sequence);
    }

    /**
     * Creates a new event with incremented retry count and error message.
     */
    public OutboxEvent markRetry(String errorMessage) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload, createdAt,
            retryCount + 1, errorMessage, sequenceNumber);
    }
}
