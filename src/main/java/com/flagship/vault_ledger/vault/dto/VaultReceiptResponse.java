package com.flagship.vault_ledger.vault.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vault_ledger.vault.VaultReceipt;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VaultReceiptResponse {

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("operation")
    VaultReceipt.Operation operation;

    @JsonProperty("user")
    String user;

    @JsonProperty("asset")
    String asset;

    @JsonProperty("asset_id")
    String assetId;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("stable_amount")
    BigInteger stableAmount;

    @JsonProperty("balance_after")
    BigInteger balanceAfter;

    @JsonProperty("recorded_at")
    Instant recordedAt;

    public static VaultReceiptResponse from(VaultReceipt receipt, String assetAddress) {
        return VaultReceiptResponse.builder()
            .eventId(receipt.getEventId())
            .operation(receipt.getOperation())
            .user(receipt.getUser())
            .asset(assetAddress)
            .assetId(receipt.getAsset().name())
            .amount(receipt.getAmount())
            .stableAmount(receipt.getStableAmount())
            .balanceAfter(receipt.getBalanceAfter())
            .recordedAt(receipt.getRecordedAt())
            .build();
    }
}
