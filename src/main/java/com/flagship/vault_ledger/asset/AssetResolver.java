package com.flagship.vault_ledger.asset;

import com.flagship.vault_ledger.config.VaultProperties;
import com.flagship.vault_ledger.exception.UnsupportedAssetException;
import org.springframework.stereotype.Component;

/**
 * Translates asset addresses into ledger keys.
 *
 * Only the zero-address sentinel and the configured stable token resolve;
 * every other address is rejected.
 */
@Component
public class AssetResolver {

    private final String stableTokenAddress;

    public AssetResolver(VaultProperties properties) {
        this.stableTokenAddress = Addresses.normalize(properties.getStableTokenAddress());
    }

    public AssetId resolve(String assetAddress) {
        if (assetAddress == null || assetAddress.isBlank()) {
            throw new UnsupportedAssetException(String.valueOf(assetAddress));
        }
        String normalized = Addresses.normalize(assetAddress);
        if (Addresses.ZERO_ADDRESS.equals(normalized)) {
            return AssetId.NATIVE;
        }
        if (stableTokenAddress.equals(normalized)) {
            return AssetId.STABLE;
        }
        throw new UnsupportedAssetException(assetAddress);
    }

    public String addressOf(AssetId asset) {
        return asset.isNative() ? Addresses.ZERO_ADDRESS : stableTokenAddress;
    }
}
