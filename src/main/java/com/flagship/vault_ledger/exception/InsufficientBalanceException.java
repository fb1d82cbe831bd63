package com.flagship.vault_ledger.exception;

import com.flagship.vault_ledger.asset.AssetId;

import java.math.BigInteger;
import java.util.Map;

public class InsufficientBalanceException extends VaultException {

    public InsufficientBalanceException(String user, AssetId asset, BigInteger available, BigInteger requested) {
        super(VaultErrorCode.INSUFFICIENT_BALANCE,
            String.format("Insufficient %s balance for %s: available=%s, requested=%s",
                asset, user, available, requested),
            Map.of("user", user, "asset", asset, "available", available, "requested", requested));
    }
}
