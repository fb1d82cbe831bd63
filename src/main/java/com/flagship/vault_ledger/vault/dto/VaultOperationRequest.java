package com.flagship.vault_ledger.vault.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

/**
 * Request body for deposits and withdrawals.
 *
 * Zero passes validation on purpose: it is rejected by the vault with a
 * typed zero-amount error.
 */
@Value
public class VaultOperationRequest {

    @NotBlank(message = "Asset is required")
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "Asset must be a 20-byte hex address")
    @JsonProperty("asset")
    String asset;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    @Digits(integer = 78, fraction = 0, message = "Amount must fit in 78 digits")
    @JsonProperty("amount")
    BigInteger amount;

    @JsonCreator
    public VaultOperationRequest(@JsonProperty("asset") String asset,
                                 @JsonProperty("amount") BigInteger amount) {
        this.asset = asset;
        this.amount = amount;
    }
}
