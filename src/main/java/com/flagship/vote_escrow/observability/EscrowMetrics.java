package com.flagship.vote_escrow.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for lock operations.
 *
 * Metrics exposed:
 * - escrow.operations: Counter of lock operations, tagged by operation and outcome
 * - escrow.operation.latency: Timer per operation
 * - escrow.tokens.locked / escrow.tokens.released: Counters of token flow
 * - escrow.early_withdraw.penalty: Counter of penalty paid to the treasury
 */
@Component
public class EscrowMetrics {

    private final MeterRegistry registry;

    private final Counter tokensLocked;
    private final Counter tokensReleased;
    private final Counter penaltiesCollected;

    public EscrowMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.tokensLocked = Counter.builder("escrow.tokens.locked")
                .description("Tokens moved into custody by deposits")
                .register(registry);

        this.tokensReleased = Counter.builder("escrow.tokens.released")
                .description("Tokens released from custody by withdrawals")
                .register(registry);

        this.penaltiesCollected = Counter.builder("escrow.early_withdraw.penalty")
                .description("Tokens paid to the treasury as early withdraw penalty")
                .register(registry);
    }

    /**
     * Records a lock operation with its outcome: success, rejected (with the
     * error code) or error.
     */
    public void recordOperation(String operation, String status) {
        registry.counter("escrow.operations",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("escrow.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordTokensLocked(double amount) {
        tokensLocked.increment(amount);
    }

    public void recordTokensReleased(double amount) {
        tokensReleased.increment(amount);
    }

    public void recordPenalty(double amount) {
        penaltiesCollected.increment(amount);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
