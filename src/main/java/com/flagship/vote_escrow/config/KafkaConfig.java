package com.flagship.vote_escrow.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topic for lock lifecycle events, created when the outbox publisher is enabled.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.locks:vote-escrow-locks}")
    private String locksTopic;

    /**
     * Events are keyed by position id, so per-position order holds on any partition count.
     */
    @Bean
    public NewTopic locksTopic() {
        return TopicBuilder.name(locksTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
