package com.flagship.vault_ledger.asset;

/**
 * The two assets the vault can hold. Used as the discriminator of the single
 * balance table, so balance rules are identical for both.
 */
public enum AssetId {
    /**
     * Chain-native volatile asset, addressed by the zero-address sentinel.
     * Valued through the price oracle.
     */
    NATIVE,

    /**
     * The configured stable token. Its smallest unit is the accounting unit.
     */
    STABLE;

    public boolean isNative() {
        return this == NATIVE;
    }
}
