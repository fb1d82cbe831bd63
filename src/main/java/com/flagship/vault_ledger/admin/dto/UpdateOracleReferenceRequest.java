package com.flagship.vault_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class UpdateOracleReferenceRequest {

    @NotBlank(message = "Oracle reference is required")
    @JsonProperty("oracle_reference")
    String oracleReference;

    @JsonCreator
    public UpdateOracleReferenceRequest(@JsonProperty("oracle_reference") String oracleReference) {
        this.oracleReference = oracleReference;
    }
}
