package com.flagship.vault_ledger.event;

import com.flagship.vault_ledger.asset.AssetId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
public class DepositRecordedEvent implements VaultEvent {
    UUID eventId;
    String user;
    AssetId assetId;
    BigInteger amount;
    BigInteger stableAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DepositRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateKey() {
        return user;
    }

    public static DepositRecordedEvent of(String user, AssetId assetId, BigInteger amount, BigInteger stableAmount) {
        return new DepositRecordedEvent(UUID.randomUUID(), user, assetId, amount, stableAmount, Instant.now());
    }
}
