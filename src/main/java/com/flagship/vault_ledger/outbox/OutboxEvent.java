package com.flagship.vault_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A vault event waiting in the outbox to be published to Kafka.
 *
 * Written in the same transaction as the operation that produced it, then
 * picked up by {@link OutboxPublisher}. Immutable: status changes produce a
 * new instance.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Vault"
    String aggregateKey;       // user address or parameter name, used as Kafka key
    String eventType;          // e.g. "DepositRecorded"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;

    public static OutboxEvent create(String aggregateType, String aggregateKey,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateKey,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null
        );
    }
}
