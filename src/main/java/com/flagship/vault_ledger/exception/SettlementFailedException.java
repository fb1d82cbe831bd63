package com.flagship.vault_ledger.exception;

import com.flagship.vault_ledger.asset.AssetId;

import java.math.BigInteger;
import java.util.Map;

/**
 * The external transfer mechanism refused or failed to move value.
 * Raised inside the operation's transaction, so the ledger mutation rolls back with it.
 */
public class SettlementFailedException extends VaultException {

    public SettlementFailedException(AssetId asset, String from, String to, BigInteger amount, String reason) {
        this(asset, from, to, amount, reason, null);
    }

    public SettlementFailedException(AssetId asset, String from, String to, BigInteger amount,
                                     String reason, Throwable cause) {
        super(VaultErrorCode.SETTLEMENT_FAILED,
            String.format("Settlement of %s %s from %s to %s failed: %s", amount, asset, from, to, reason),
            Map.of("asset", asset, "from", from, "to", to, "amount", amount, "reason", reason),
            cause);
    }
}
