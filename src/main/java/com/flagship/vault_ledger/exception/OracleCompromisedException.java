package com.flagship.vault_ledger.exception;

import java.math.BigInteger;
import java.util.Map;

/**
 * The price feed reported a price that cannot be used (zero, negative,
 * never updated, or no round at all).
 */
public class OracleCompromisedException extends VaultException {

    public OracleCompromisedException(String oracleReference, BigInteger reportedPrice, String reason) {
        super(VaultErrorCode.ORACLE_COMPROMISED,
            String.format("Oracle %s is compromised: %s (price=%s)", oracleReference, reason, reportedPrice),
            Map.of("oracleReference", oracleReference,
                "reportedPrice", reportedPrice == null ? "none" : reportedPrice,
                "reason", reason));
    }
}
