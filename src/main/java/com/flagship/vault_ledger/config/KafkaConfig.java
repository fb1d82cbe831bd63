package com.flagship.vault_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for vault audit events.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.vault-events:vault-events}")
    private String vaultEventsTopic;

    /**
     * Creates the topic if it doesn't exist. Events are keyed by user address
     * or parameter name, so partitioning keeps per-key order.
     */
    @Bean
    @ConditionalOnProperty(name = "kafka.topic.auto-create", havingValue = "true", matchIfMissing = true)
    public NewTopic vaultEventsTopic() {
        return TopicBuilder.name(vaultEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
