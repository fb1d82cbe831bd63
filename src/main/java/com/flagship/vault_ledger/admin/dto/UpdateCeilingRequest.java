package com.flagship.vault_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

/**
 * New value for one of the capital ceilings, in stable units.
 */
@Value
public class UpdateCeilingRequest {

    @NotNull(message = "Ceiling is required")
    @PositiveOrZero(message = "Ceiling must not be negative")
    @Digits(integer = 78, fraction = 0, message = "Ceiling must fit in 78 digits")
    @JsonProperty("ceiling")
    BigInteger ceiling;

    @JsonCreator
    public UpdateCeilingRequest(@JsonProperty("ceiling") BigInteger ceiling) {
        this.ceiling = ceiling;
    }
}
