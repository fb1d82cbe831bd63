package com.flagship.vault_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vault_ledger.admin.PolicyParameters;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

@Value
@Builder
public class PolicyParametersResponse {

    @JsonProperty("global_deposit_ceiling")
    BigInteger globalDepositCeiling;

    @JsonProperty("bank_capital_ceiling")
    BigInteger bankCapitalCeiling;

    @JsonProperty("per_withdrawal_ceiling")
    BigInteger perWithdrawalCeiling;

    @JsonProperty("oracle_reference")
    String oracleReference;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PolicyParametersResponse from(PolicyParameters parameters, BigInteger perWithdrawalCeiling) {
        return PolicyParametersResponse.builder()
            .globalDepositCeiling(parameters.getGlobalDepositCeiling())
            .bankCapitalCeiling(parameters.getBankCapitalCeiling())
            .perWithdrawalCeiling(perWithdrawalCeiling)
            .oracleReference(parameters.getOracleReference())
            .updatedAt(parameters.getUpdatedAt())
            .build();
    }
}
