package com.flagship.vault_ledger.vault;

import com.flagship.vault_ledger.asset.AssetId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Result of a committed deposit or withdrawal.
 */
@Value
public class VaultReceipt {

    public enum Operation {
        DEPOSIT,
        WITHDRAWAL
    }

    UUID eventId;
    Operation operation;
    String user;
    AssetId asset;
    BigInteger amount;
    /** Deposit value counted against the ceilings; null for withdrawals. */
    BigInteger stableAmount;
    BigInteger balanceAfter;
    Instant recordedAt;
}
