package com.flagship.vault_ledger.ledger;

import lombok.Value;

import java.math.BigInteger;

/**
 * Process-wide aggregates of the vault.
 *
 * totalDeposits is lifetime inflow in stable units: it grows on every deposit
 * and is never reduced by withdrawals or revalued when prices move.
 */
@Value
public class LedgerCounters {
    BigInteger totalDeposits;
    long depositCount;
    long withdrawalCount;
}
