package com.flagship.vault_ledger.exception;

import java.util.Map;

public class ReentrantCallException extends VaultException {

    public ReentrantCallException(String operation) {
        super(VaultErrorCode.REENTRANT_CALL,
            "Re-entrant call rejected: " + operation + " attempted while a guarded operation is in progress",
            Map.of("operation", operation));
    }
}
