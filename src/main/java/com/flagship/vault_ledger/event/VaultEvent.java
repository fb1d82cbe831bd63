package com.flagship.vault_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for audit events emitted by the vault.
 *
 * Events are facts: each one is written exactly once, after the operation's
 * state mutation and settlement have succeeded, in the same transaction.
 */
public interface VaultEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * Key the event is partitioned by: the user for balance events,
     * the parameter name for administrative ones.
     */
    String getAggregateKey();

    Instant getOccurredAt();

    String getEventType();
}
