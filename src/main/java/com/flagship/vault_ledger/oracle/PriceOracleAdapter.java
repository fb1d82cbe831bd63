package com.flagship.vault_ledger.oracle;

import com.flagship.vault_ledger.admin.PolicyParametersRepository;
import com.flagship.vault_ledger.config.VaultProperties;
import com.flagship.vault_ledger.exception.OracleCompromisedException;
import com.flagship.vault_ledger.exception.OracleStaleException;
import com.flagship.vault_ledger.observability.VaultMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;

/**
 * Values the volatile asset in the stable accounting unit.
 *
 * Every call re-reads the feed named by the current oracle reference and
 * re-validates it; prices are never cached between operations.
 *
 * Conversion: {@code amount * price / 10^(volatileDecimals + feedDecimals - stableDecimals)},
 * rounded down. The truncated remainder is discarded.
 */
@Component
@Slf4j
public class PriceOracleAdapter {

    private final PriceFeedDirectory feedDirectory;
    private final PolicyParametersRepository policyParameters;
    private final VaultMetrics vaultMetrics;
    private final Clock clock;
    private final long heartbeatSeconds;
    private final BigInteger scalingFactor;

    public PriceOracleAdapter(PriceFeedDirectory feedDirectory,
                              PolicyParametersRepository policyParameters,
                              VaultProperties properties,
                              VaultMetrics vaultMetrics,
                              Clock clock) {
        this.feedDirectory = feedDirectory;
        this.policyParameters = policyParameters;
        this.vaultMetrics = vaultMetrics;
        this.clock = clock;

        VaultProperties.Oracle oracle = properties.getOracle();
        this.heartbeatSeconds = oracle.getHeartbeat().getSeconds();
        int exponent = oracle.getVolatileDecimals() + oracle.getFeedDecimals() - oracle.getStableDecimals();
        if (exponent < 0) {
            throw new IllegalStateException(
                "Stable decimals must not exceed volatile decimals plus feed decimals");
        }
        this.scalingFactor = BigInteger.TEN.pow(exponent);
    }

    /**
     * Returns the current volatile-asset price in feed precision. A rejected
     * read is counted and logged before the exception propagates.
     *
     * @throws OracleCompromisedException if the feed has no round, a non-positive price or no update time
     * @throws OracleStaleException if the last update is older than the heartbeat
     */
    public BigInteger currentVolatileAssetPrice() {
        try {
            return validatedPrice();
        } catch (OracleStaleException e) {
            vaultMetrics.recordOracleRejection("stale");
            log.warn("Rejected stale oracle price: reference={}, ageSeconds={}, heartbeatSeconds={}",
                    e.getDetails().get("oracleReference"), e.getDetails().get("ageSeconds"), heartbeatSeconds);
            throw e;
        } catch (OracleCompromisedException e) {
            vaultMetrics.recordOracleRejection("compromised");
            log.warn("Rejected compromised oracle price: reference={}, price={}, reason={}",
                    e.getDetails().get("oracleReference"), e.getDetails().get("reportedPrice"), e.getDetails().get("reason"));
            throw e;
        }
    }

    /**
     * Same validation as {@link #currentVolatileAssetPrice()} without recording
     * a rejection. Used by health checks, which poll regardless of traffic.
     */
    public BigInteger peekVolatileAssetPrice() {
        return validatedPrice();
    }

    public BigInteger convertVolatileToStable(BigInteger amount) {
        BigInteger price = currentVolatileAssetPrice();
        return amount.multiply(price).divide(scalingFactor);
    }

    public BigInteger getScalingFactor() {
        return scalingFactor;
    }

    private BigInteger validatedPrice() {
        String reference = policyParameters.currentOracleReference();
        RoundData round = feedDirectory.resolve(reference).latestRoundData()
            .orElseThrow(() -> new OracleCompromisedException(reference, null, "no round published"));

        BigInteger price = round.getAnswer();
        if (price == null || price.signum() <= 0) {
            throw new OracleCompromisedException(reference, price, "non-positive price");
        }
        if (round.getUpdatedAt() <= 0) {
            throw new OracleCompromisedException(reference, price, "round never updated");
        }

        long ageSeconds = clock.instant().getEpochSecond() - round.getUpdatedAt();
        if (ageSeconds > heartbeatSeconds) {
            throw new OracleStaleException(reference, round.getUpdatedAt(), ageSeconds, heartbeatSeconds);
        }
        return price;
    }
}
