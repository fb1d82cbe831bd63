package com.flagship.vault_ledger.vault.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vault_ledger.ledger.VaultHoldings;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class HoldingsResponse {

    @JsonProperty("native_held")
    BigInteger nativeHeld;

    @JsonProperty("stable_held")
    BigInteger stableHeld;

    @JsonProperty("native_value_in_stable")
    BigInteger nativeValueInStable;

    @JsonProperty("total_held_value")
    BigInteger totalHeldValue;

    public static HoldingsResponse from(VaultHoldings holdings) {
        return HoldingsResponse.builder()
            .nativeHeld(holdings.getNativeHeld())
            .stableHeld(holdings.getStableHeld())
            .nativeValueInStable(holdings.getNativeValueInStable())
            .totalHeldValue(holdings.getTotalHeldValue())
            .build();
    }
}
