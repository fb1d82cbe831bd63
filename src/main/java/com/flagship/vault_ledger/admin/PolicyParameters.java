package com.flagship.vault_ledger.admin;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Administrator-owned parameters: the two capital ceilings and the oracle reference.
 */
@Value
public class PolicyParameters {
    BigInteger globalDepositCeiling;
    BigInteger bankCapitalCeiling;
    String oracleReference;
    Instant updatedAt;
}
