package com.flagship.vault_ledger.settlement;

import java.math.BigInteger;

/**
 * Transfer mechanism of the chain-native asset.
 */
public interface NativeAssetGateway {

    /**
     * Moves native value between two accounts.
     *
     * @return false if the transfer was refused, for example when the sender cannot cover it
     */
    boolean transfer(String from, String to, BigInteger amount);

    BigInteger balanceOf(String account);
}
