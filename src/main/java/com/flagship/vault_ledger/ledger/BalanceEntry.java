package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.asset.AssetId;
import lombok.Value;

import java.math.BigInteger;

@Value
public class BalanceEntry {
    String user;
    AssetId asset;
    BigInteger amount;
}
