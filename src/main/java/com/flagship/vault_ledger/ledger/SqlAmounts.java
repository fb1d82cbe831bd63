package com.flagship.vault_ledger.ledger;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Conversions between smallest-unit amounts and NUMERIC(78,0) columns.
 */
public final class SqlAmounts {

    private SqlAmounts() {
        // Utility class
    }

    public static BigDecimal toColumn(BigInteger amount) {
        return new BigDecimal(amount);
    }

    public static BigInteger fromColumn(BigDecimal value) {
        return value == null ? BigInteger.ZERO : value.toBigIntegerExact();
    }
}
