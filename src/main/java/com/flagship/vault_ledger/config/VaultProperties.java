package com.flagship.vault_ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Vault configuration, bound from the {@code vault.*} tree of application.yml.
 *
 * Ceilings are expressed in the stable accounting unit, the per-withdrawal
 * ceiling in the smallest unit of the asset being withdrawn.
 */
@Validated
@ConfigurationProperties(prefix = "vault")
@Getter
@Setter
public class VaultProperties {

    private static final String ADDRESS_PATTERN = "^0x[0-9a-fA-F]{40}$";

    /**
     * Custody address that holds every asset deposited into the vault.
     */
    @NotBlank
    @Pattern(regexp = ADDRESS_PATTERN)
    private String vaultAddress;

    /**
     * The single identity allowed to retune ceilings and replace the oracle.
     */
    @NotBlank
    @Pattern(regexp = ADDRESS_PATTERN)
    private String adminAddress;

    /**
     * Token address of the designated stable asset.
     */
    @NotBlank
    @Pattern(regexp = ADDRESS_PATTERN)
    private String stableTokenAddress;

    /**
     * Fixed per-withdrawal ceiling. Not tunable at runtime.
     */
    @NotNull
    private BigInteger perWithdrawalCeiling;

    /**
     * Ceilings written on first start, when no policy row exists yet.
     */
    @NotNull
    private BigInteger initialGlobalDepositCeiling;

    @NotNull
    private BigInteger initialBankCapitalCeiling;

    @Valid
    private Oracle oracle = new Oracle();

    @Getter
    @Setter
    public static class Oracle {
        /** Feed reference written on first start. */
        @NotBlank
        private String initialReference;

        /** Maximum tolerated age of the last price update. */
        @NotNull
        private Duration heartbeat = Duration.ofSeconds(3600);

        @Min(0)
        private int volatileDecimals = 18;

        @Min(0)
        private int feedDecimals = 8;

        @Min(0)
        private int stableDecimals = 6;
    }
}
