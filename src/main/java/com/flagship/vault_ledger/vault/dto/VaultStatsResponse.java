package com.flagship.vault_ledger.vault.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vault_ledger.vault.VaultStats;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Aggregate counters and ceilings. totalDeposits is the sum of deposits at
 * their conversion-time value and is never reduced by withdrawals.
 */
@Value
@Builder
public class VaultStatsResponse {

    @JsonProperty("total_deposits")
    BigInteger totalDeposits;

    @JsonProperty("deposit_count")
    long depositCount;

    @JsonProperty("withdrawal_count")
    long withdrawalCount;

    @JsonProperty("global_deposit_ceiling")
    BigInteger globalDepositCeiling;

    @JsonProperty("bank_capital_ceiling")
    BigInteger bankCapitalCeiling;

    @JsonProperty("per_withdrawal_ceiling")
    BigInteger perWithdrawalCeiling;

    @JsonProperty("oracle_reference")
    String oracleReference;

    public static VaultStatsResponse from(VaultStats stats) {
        return VaultStatsResponse.builder()
            .totalDeposits(stats.getCounters().getTotalDeposits())
            .depositCount(stats.getCounters().getDepositCount())
            .withdrawalCount(stats.getCounters().getWithdrawalCount())
            .globalDepositCeiling(stats.getParameters().getGlobalDepositCeiling())
            .bankCapitalCeiling(stats.getParameters().getBankCapitalCeiling())
            .perWithdrawalCeiling(stats.getPerWithdrawalCeiling())
            .oracleReference(stats.getParameters().getOracleReference())
            .build();
    }
}
