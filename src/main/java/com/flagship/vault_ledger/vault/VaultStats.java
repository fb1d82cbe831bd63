package com.flagship.vault_ledger.vault;

import com.flagship.vault_ledger.admin.PolicyParameters;
import com.flagship.vault_ledger.ledger.LedgerCounters;
import lombok.Value;

import java.math.BigInteger;

/**
 * Aggregate counters next to the ceilings they are checked against.
 */
@Value
public class VaultStats {
    LedgerCounters counters;
    PolicyParameters parameters;
    BigInteger perWithdrawalCeiling;
}
