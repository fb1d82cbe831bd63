package com.flagship.vault_ledger.settlement;

import com.flagship.vault_ledger.asset.Addresses;
import com.flagship.vault_ledger.asset.AssetId;
import com.flagship.vault_ledger.config.VaultProperties;
import com.flagship.vault_ledger.exception.SettlementFailedException;
import com.flagship.vault_ledger.exception.VaultException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * Moves value between users and the vault's custody address.
 *
 * Must run inside the caller's transaction, after the ledger has been
 * mutated. A refused transfer or an unexpected gateway failure surfaces as
 * {@link SettlementFailedException}, which rolls the ledger mutation back
 * together with everything else in that transaction. Vault rule violations
 * raised from inside a transfer (a re-entrant call, for instance) propagate
 * unchanged.
 */
@Service
@Slf4j
public class SettlementService {

    private final NativeAssetGateway nativeGateway;
    private final StableToken stableToken;
    private final String vaultAddress;

    public SettlementService(NativeAssetGateway nativeGateway, StableToken stableToken, VaultProperties properties) {
        this.nativeGateway = nativeGateway;
        this.stableToken = stableToken;
        this.vaultAddress = Addresses.normalize(properties.getVaultAddress());
    }

    /**
     * Pulls a deposit from the user into the vault.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void collectDeposit(String user, AssetId asset, BigInteger amount) {
        boolean success = execute(asset, user, vaultAddress, amount, () -> asset.isNative()
            ? nativeGateway.transfer(user, vaultAddress, amount)
            : stableToken.transferFrom(user, vaultAddress, amount));
        requireSuccess(success, asset, user, vaultAddress, amount);
    }

    /**
     * Pays a withdrawal out of the vault to the user.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void payOut(String user, AssetId asset, BigInteger amount) {
        boolean success = execute(asset, vaultAddress, user, amount, () -> asset.isNative()
            ? nativeGateway.transfer(vaultAddress, user, amount)
            : stableToken.transfer(user, amount));
        requireSuccess(success, asset, vaultAddress, user, amount);
    }

    public BigInteger vaultBalance(AssetId asset) {
        return asset.isNative() ? nativeGateway.balanceOf(vaultAddress) : stableToken.balanceOf(vaultAddress);
    }

    public String getVaultAddress() {
        return vaultAddress;
    }

    private boolean execute(AssetId asset, String from, String to, BigInteger amount, TransferCall call) {
        try {
            return call.transfer();
        } catch (VaultException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Transfer raised an error: asset={}, from={}, to={}, amount={}", asset, from, to, amount, e);
            throw new SettlementFailedException(asset, from, to, amount, e.getClass().getSimpleName(), e);
        }
    }

    private void requireSuccess(boolean success, AssetId asset, String from, String to, BigInteger amount) {
        if (!success) {
            log.warn("Transfer refused: asset={}, from={}, to={}, amount={}", asset, from, to, amount);
            throw new SettlementFailedException(asset, from, to, amount, "transfer returned false");
        }
        log.debug("Transfer settled: asset={}, from={}, to={}, amount={}", asset, from, to, amount);
    }

    @FunctionalInterface
    private interface TransferCall {
        boolean transfer();
    }
}
