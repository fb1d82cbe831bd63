package com.flagship.vault_ledger.exception;

import java.math.BigInteger;
import java.util.Map;

public class PerTransactionLimitExceededException extends VaultException {

    public PerTransactionLimitExceededException(String user, BigInteger requested, BigInteger ceiling) {
        super(VaultErrorCode.PER_TRANSACTION_LIMIT_EXCEEDED,
            String.format("Withdrawal of %s exceeds the per-transaction ceiling of %s", requested, ceiling),
            Map.of("user", user, "requested", requested, "ceiling", ceiling));
    }
}
