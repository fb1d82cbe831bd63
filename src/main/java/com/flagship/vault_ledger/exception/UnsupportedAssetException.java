package com.flagship.vault_ledger.exception;

import java.util.Map;

public class UnsupportedAssetException extends VaultException {

    public UnsupportedAssetException(String assetAddress) {
        super(VaultErrorCode.UNSUPPORTED_ASSET,
            "Asset is not held by this vault: " + assetAddress,
            Map.of("asset", assetAddress));
    }
}
