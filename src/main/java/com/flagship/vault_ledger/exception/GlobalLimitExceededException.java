package com.flagship.vault_ledger.exception;

import java.math.BigInteger;
import java.util.Map;

/**
 * A deposit would push lifetime deposit inflow above the global deposit ceiling.
 */
public class GlobalLimitExceededException extends VaultException {

    public GlobalLimitExceededException(BigInteger totalDeposits, BigInteger amount, BigInteger ceiling) {
        super(VaultErrorCode.GLOBAL_LIMIT_EXCEEDED,
            String.format("Deposit of %s on top of %s exceeds the global deposit ceiling of %s",
                amount, totalDeposits, ceiling),
            Map.of("totalDeposits", totalDeposits, "amount", amount, "ceiling", ceiling));
    }
}
