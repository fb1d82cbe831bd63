package com.flagship.vault_ledger.settlement;

import com.flagship.vault_ledger.asset.Addresses;
import com.flagship.vault_ledger.asset.AssetId;
import com.flagship.vault_ledger.config.VaultProperties;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Stable token whose holder is the vault's custody address.
 * Custody deposits are pre-approved, so {@code transferFrom} needs no allowance.
 */
@Component
public class JdbcStableToken implements StableToken {

    private final CustodyWalletRepository wallets;
    private final String vaultAddress;

    public JdbcStableToken(CustodyWalletRepository wallets, VaultProperties properties) {
        this.wallets = wallets;
        this.vaultAddress = Addresses.normalize(properties.getVaultAddress());
    }

    @Override
    public boolean transferFrom(String from, String to, BigInteger amount) {
        return wallets.move(Addresses.normalize(from), Addresses.normalize(to), AssetId.STABLE, amount);
    }

    @Override
    public boolean transfer(String to, BigInteger amount) {
        return wallets.move(vaultAddress, Addresses.normalize(to), AssetId.STABLE, amount);
    }

    @Override
    public BigInteger balanceOf(String account) {
        return wallets.balanceOf(Addresses.normalize(account), AssetId.STABLE);
    }
}
