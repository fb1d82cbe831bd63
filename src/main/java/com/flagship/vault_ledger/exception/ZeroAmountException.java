package com.flagship.vault_ledger.exception;

import java.util.Map;

public class ZeroAmountException extends VaultException {

    public ZeroAmountException(String operation, String user) {
        super(VaultErrorCode.ZERO_AMOUNT,
            String.format("%s of zero rejected for %s", operation, user),
            Map.of("operation", operation, "user", user));
    }
}
