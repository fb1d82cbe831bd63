package com.flagship.vault_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class OracleReferenceChangedEvent implements VaultEvent {
    UUID eventId;
    String previousReference;
    String newReference;
    String changedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OracleReferenceChanged";
    public static final String AGGREGATE_KEY = "oracle-reference";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateKey() {
        return AGGREGATE_KEY;
    }

    public static OracleReferenceChangedEvent of(String previousReference, String newReference, String changedBy) {
        return new OracleReferenceChangedEvent(
            UUID.randomUUID(), previousReference, newReference, changedBy, Instant.now());
    }
}
