package com.flagship.vote_escrow.observability;

import com.flagship.vote_escrow.outbox.OutboxService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the lock event outbox.
 *
 * - outbox.backlog.size: events waiting to be published
 * - outbox.backlog.age.seconds: age of the oldest waiting event
 * - outbox.events.failed: events that exhausted their retries
 * - outbox.events.published / outbox.events.dead_lettered: publish outcomes
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxService outboxService;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    // refreshed by MetricsScheduler, read on scrape
    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong failedEventCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished events in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", failedEventCount, AtomicLong::get)
                .description("Number of events that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);

        log.info("Outbox metrics registered with Micrometer");
    }

    public void refreshMetrics() {
        long unpublished = outboxService.countUnpublished();
        backlogSize.set(unpublished);

        outboxService.findOldestUnpublishedCreatedAt()
                .ifPresentOrElse(
                        oldest -> oldestEventAgeSeconds.set(
                                Math.max(0, Duration.between(oldest, Instant.now()).getSeconds())),
                        () -> oldestEventAgeSeconds.set(0)
                );

        long failed = outboxService.countByRetryCountAtLeast(maxRetries);
        failedEventCount.set(failed);

        log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, failed={}",
                unpublished, oldestEventAgeSeconds.get(), failed);
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}
