package com.flagship.vote_escrow.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.vote_escrow.event.LockEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory transactional outbox for lock events.
 *
 * Writing an event is split in two steps so that it commits together with the
 * ledger state:
 * 1. {@link #prepareEvents(List)} serializes the events; it may fail, and runs
 *    before any token moves or ledger state change
 * 2. {@link #enqueue(List)} appends the prepared events; it cannot fail, and
 *    runs once the new ledger state is published
 *
 * Published events leave the outbox. Events are NOT published here; that is
 * done by the OutboxPublisher.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String AGGREGATE_TYPE = "Lock";

    private final ObjectMapper objectMapper;

    private final Map<UUID, OutboxEvent> pending = new LinkedHashMap<>();
    private long nextSequence = 1;

    /**
     * Serializes lifecycle events into outbox entries without storing them.
     *
     * @throws IllegalArgumentException if an event cannot be serialized
     */
    public List<OutboxEvent> prepareEvents(List<? extends LockEvent> events) {
        List<OutboxEvent> prepared = new ArrayList<>(events.size());
        for (LockEvent event : events) {
            prepared.add(OutboxEvent.create(AGGREGATE_TYPE, event.getPositionId(),
                event.getEventType(), serializePayload(event)));
        }
        return prepared;
    }

    public synchronized void enqueue(List<OutboxEvent> events) {
        for (OutboxEvent event : events) {
            OutboxEvent sequenced = event.withSequenceNumber(nextSequence++);
            pending.put(sequenced.getId(), sequenced);
            log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                sequenced.getEventType(), sequenced.getAggregateType(), sequenced.getAggregateId());
        }
    }

    /**
     * Finds unpublished events for the publisher to process, oldest first.
     *
     * @param limit Maximum number of events to fetch
     */
    public synchronized List<OutboxEvent> findUnpublishedEvents(int limit) {
        return pending.values().stream()
            .limit(limit)
            .toList();
    }

    /**
     * Marks an event as successfully published and drops it from the outbox.
     */
    public synchronized void markPublished(UUID eventId) {
        OutboxEvent removed = pending.remove(eventId);
        if (removed != null) {
            log.debug("Marked event {} as published", eventId);
        }
    }

    /**
     * Marks an event as failed with an error message.
     */
    public synchronized void markFailed(UUID eventId, String errorMessage) {
        OutboxEvent event = pending.get(eventId);
        if (event != null) {
            OutboxEvent retried = event.markRetry(errorMessage);
            pending.put(eventId, retried);
            log.warn("Marked event {} as failed (retry #{}): {}",
                eventId, retried.getRetryCount(), errorMessage);
        }
    }

    /**
     * Pending events for a position (for debugging/auditing).
     */
    public synchronized List<OutboxEvent> getEventsForPosition(long positionId) {
        return pending.values().stream()
            .filter(event -> event.getAggregateId() == positionId)
            .toList();
    }

    public synchronized long countUnpublished() {
        return pending.size();
    }

    public synchronized long countByRetryCountAtLeast(int retries) {
        return pending.values().stream()
            .filter(event -> event.getRetryCount() >= retries)
            .count();
    }

    public synchronized Optional<Instant> findOldestUnpublishedCreatedAt() {
        return pending.values().stream()
            .map(OutboxEvent::getCreatedAt)
            .min(Instant::compareTo);
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
