package com.flagship.vault_ledger.exception;

import java.math.BigInteger;
import java.util.Map;

public class BankCapitalExceededException extends VaultException {

    public BankCapitalExceededException(BigInteger totalDeposits, BigInteger amount, BigInteger ceiling) {
        super(VaultErrorCode.BANK_CAPITAL_EXCEEDED,
            String.format("Deposit of %s on top of %s exceeds the bank capital ceiling of %s",
                amount, totalDeposits, ceiling),
            Map.of("totalDeposits", totalDeposits, "amount", amount, "ceiling", ceiling));
    }
}
