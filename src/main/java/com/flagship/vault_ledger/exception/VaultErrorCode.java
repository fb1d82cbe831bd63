package com.flagship.vault_ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Typed failure conditions of the vault.
 *
 * Every rejected operation carries exactly one of these codes so callers can
 * tell which rule was violated without parsing messages.
 */
public enum VaultErrorCode {
    ORACLE_COMPROMISED(HttpStatus.SERVICE_UNAVAILABLE),
    ORACLE_STALE(HttpStatus.SERVICE_UNAVAILABLE),
    PER_TRANSACTION_LIMIT_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY),
    INSUFFICIENT_BALANCE(HttpStatus.UNPROCESSABLE_ENTITY),
    GLOBAL_LIMIT_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY),
    BANK_CAPITAL_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY),
    SETTLEMENT_FAILED(HttpStatus.BAD_GATEWAY),
    REENTRANT_CALL(HttpStatus.CONFLICT),
    UNAUTHORIZED(HttpStatus.FORBIDDEN),
    ZERO_AMOUNT(HttpStatus.BAD_REQUEST),
    UNSUPPORTED_ASSET(HttpStatus.BAD_REQUEST);

    private final HttpStatus httpStatus;

    VaultErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
