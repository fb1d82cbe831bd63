package com.flagship.vault_ledger.vault.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

@Value
public class BalanceResponse {

    @JsonProperty("user")
    String user;

    @JsonProperty("asset")
    String asset;

    @JsonProperty("asset_id")
    String assetId;

    @JsonProperty("balance")
    BigInteger balance;
}
