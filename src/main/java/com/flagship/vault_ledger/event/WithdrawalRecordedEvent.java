package com.flagship.vault_ledger.event;

import com.flagship.vault_ledger.asset.AssetId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
public class WithdrawalRecordedEvent implements VaultEvent {
    UUID eventId;
    String user;
    AssetId assetId;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WithdrawalRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateKey() {
        return user;
    }

    public static WithdrawalRecordedEvent of(String user, AssetId assetId, BigInteger amount) {
        return new WithdrawalRecordedEvent(UUID.randomUUID(), user, assetId, amount, Instant.now());
    }
}
