package com.flagship.vault_ledger.exception;

import java.util.Map;

/**
 * The last price update is older than the configured heartbeat.
 */
public class OracleStaleException extends VaultException {

    public OracleStaleException(String oracleReference, long updatedAt, long ageSeconds, long heartbeatSeconds) {
        super(VaultErrorCode.ORACLE_STALE,
            String.format("Oracle %s is stale: last update %ds ago exceeds heartbeat of %ds",
                oracleReference, ageSeconds, heartbeatSeconds),
            Map.of("oracleReference", oracleReference,
                "updatedAt", updatedAt,
                "ageSeconds", ageSeconds,
                "heartbeatSeconds", heartbeatSeconds));
    }
}
