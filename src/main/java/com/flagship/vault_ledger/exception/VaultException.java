package com.flagship.vault_ledger.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for every rule violation raised by the vault.
 *
 * Subclasses are thrown before any state mutation, or from inside the
 * operation's transaction so that the whole call rolls back. The details map
 * carries the amounts and identities relevant to the failure.
 */
public abstract class VaultException extends RuntimeException {

    private final VaultErrorCode code;
    private final Map<String, String> details;

    protected VaultException(VaultErrorCode code, String message, Map<String, ?> details) {
        this(code, message, details, null);
    }

    protected VaultException(VaultErrorCode code, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        Map<String, String> copy = new LinkedHashMap<>();
        details.forEach((key, value) -> copy.put(key, String.valueOf(value)));
        this.details = Collections.unmodifiableMap(copy);
    }

    public VaultErrorCode getCode() {
        return code;
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
