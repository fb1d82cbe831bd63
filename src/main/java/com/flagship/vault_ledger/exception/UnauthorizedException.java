package com.flagship.vault_ledger.exception;

import java.util.Map;

public class UnauthorizedException extends VaultException {

    public UnauthorizedException(String caller, String operation) {
        super(VaultErrorCode.UNAUTHORIZED,
            String.format("Caller %s is not allowed to %s", caller, operation),
            Map.of("caller", caller, "operation", operation));
    }
}
