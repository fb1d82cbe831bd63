package com.flagship.vault_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of an administrator retuning one of the capital ceilings.
 */
@Value
public class PolicyCeilingChangedEvent implements VaultEvent {
    UUID eventId;
    Ceiling ceiling;
    BigInteger previousValue;
    BigInteger newValue;
    String changedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PolicyCeilingChanged";

    public enum Ceiling {
        GLOBAL_DEPOSIT,
        BANK_CAPITAL
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateKey() {
        return ceiling.name();
    }

    public static PolicyCeilingChangedEvent of(Ceiling ceiling, BigInteger previousValue, BigInteger newValue,
                                               String changedBy) {
        return new PolicyCeilingChangedEvent(
            UUID.randomUUID(), ceiling, previousValue, newValue, changedBy, Instant.now());
    }
}
