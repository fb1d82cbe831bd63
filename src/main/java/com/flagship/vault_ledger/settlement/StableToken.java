package com.flagship.vault_ledger.settlement;

import java.math.BigInteger;

/**
 * Fungible-token interface of the stable asset, seen from the vault's account.
 *
 * Transfer calls report success through their return value; callers must check it.
 */
public interface StableToken {

    boolean transferFrom(String from, String to, BigInteger amount);

    /**
     * Transfers from the vault's own account.
     */
    boolean transfer(String to, BigInteger amount);

    BigInteger balanceOf(String account);
}
