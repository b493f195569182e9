package com.flagship.vote_escrow.observability;

import com.flagship.vote_escrow.outbox.OutboxService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the escrow service.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many lock events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxService outboxService;

        public OutboxHealthIndicator(OutboxService outboxService) {
            this.outboxService = outboxService;
        }

        @Override
        public Health health() {
            long backlogSize = outboxService.countUnpublished();

            Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();

            return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
        }
    }

    /**
     * Kafka connectivity; only relevant while the outbox publisher runs.
     */
    @Component("kafkaHealth")
    @ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
