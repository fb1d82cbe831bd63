package com.flagship.vault_ledger.settlement;

import com.flagship.vault_ledger.asset.Addresses;
import com.flagship.vault_ledger.asset.AssetId;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

@Component
public class JdbcNativeAssetGateway implements NativeAssetGateway {

    private final CustodyWalletRepository wallets;

    public JdbcNativeAssetGateway(CustodyWalletRepository wallets) {
        this.wallets = wallets;
    }

    @Override
    public boolean transfer(String from, String to, BigInteger amount) {
        return wallets.move(Addresses.normalize(from), Addresses.normalize(to), AssetId.NATIVE, amount);
    }

    @Override
    public BigInteger balanceOf(String account) {
        return wallets.balanceOf(Addresses.normalize(account), AssetId.NATIVE);
    }
}
