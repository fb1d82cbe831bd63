package com.flagship.vault_ledger.ledger;

import lombok.Value;

import java.math.BigInteger;

/**
 * Live solvency snapshot: what the custody address actually holds right now,
 * valued at the current oracle price.
 */
@Value
public class VaultHoldings {
    BigInteger nativeHeld;
    BigInteger stableHeld;
    BigInteger nativeValueInStable;
    BigInteger totalHeldValue;
}
