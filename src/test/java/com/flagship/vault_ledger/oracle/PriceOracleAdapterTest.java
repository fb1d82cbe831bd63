package com.flagship.vault_ledger.oracle;

import com.flagship.vault_ledger.admin.PolicyParametersRepository;
import com.flagship.vault_ledger.config.VaultProperties;
import com.flagship.vault_ledger.exception.OracleCompromisedException;
import com.flagship.vault_ledger.exception.OracleStaleException;
import com.flagship.vault_ledger.observability.VaultMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PriceOracleAdapterTest {

    private static final long NOW = 1_700_000_000L;
    private static final String REFERENCE = "native-usd";
    private static final BigInteger PRICE_2000 = BigInteger.valueOf(2000).multiply(BigInteger.TEN.pow(8));
    private static final BigInteger ONE_NATIVE = BigInteger.TEN.pow(18);

    private PriceFeedDirectory feedDirectory;
    private PriceFeed feed;
    private PolicyParametersRepository policyParameters;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        feedDirectory = mock(PriceFeedDirectory.class);
        feed = mock(PriceFeed.class);
        policyParameters = mock(PolicyParametersRepository.class);
        meterRegistry = new SimpleMeterRegistry();

        when(policyParameters.currentOracleReference()).thenReturn(REFERENCE);
        when(feedDirectory.resolve(REFERENCE)).thenReturn(feed);
    }

    private PriceOracleAdapter adapter(int stableDecimals) {
        VaultProperties properties = new VaultProperties();
        properties.getOracle().setStableDecimals(stableDecimals);
        properties.getOracle().setInitialReference(REFERENCE);
        Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
        return new PriceOracleAdapter(feedDirectory, policyParameters, properties,
            new VaultMetrics(meterRegistry), clock);
    }

    private void latestRound(BigInteger answer, long updatedAt) {
        when(feed.latestRoundData()).thenReturn(Optional.of(
            new RoundData(BigInteger.ONE, answer, updatedAt, updatedAt, BigInteger.ONE)));
    }

    @Nested
    @DisplayName("Conversion")
    class Conversion {

        @Test
        @DisplayName("One volatile unit at 2000 converts to 2000 with zero stable decimals")
        void convertsWholeUnit() {
            latestRound(PRICE_2000, NOW);

            assertEquals(BigInteger.valueOf(2000), adapter(0).convertVolatileToStable(ONE_NATIVE));
        }

        @Test
        @DisplayName("Default 6 stable decimals keep micro-unit precision")
        void convertsWithSixStableDecimals() {
            latestRound(PRICE_2000, NOW);

            PriceOracleAdapter adapter = adapter(6);

            assertEquals(BigInteger.TEN.pow(20), adapter.getScalingFactor());
            assertEquals(BigInteger.valueOf(2_000_000_000L), adapter.convertVolatileToStable(ONE_NATIVE));
        }

        @Test
        @DisplayName("Remainders are truncated toward zero")
        void truncatesRemainder() {
            latestRound(PRICE_2000, NOW);

            // 0.0004999... of a unit is worth 0.9999... stable units
            BigInteger amount = BigInteger.valueOf(499_999_999_999_999L);
            assertEquals(BigInteger.ZERO, adapter(0).convertVolatileToStable(amount));
            assertEquals(BigInteger.ONE, adapter(0).convertVolatileToStable(BigInteger.valueOf(500_000_000_000_000L)));
        }

        @Test
        @DisplayName("Every conversion re-reads the feed")
        void neverCaches() {
            latestRound(PRICE_2000, NOW);
            PriceOracleAdapter adapter = adapter(0);

            adapter.convertVolatileToStable(ONE_NATIVE);
            adapter.convertVolatileToStable(ONE_NATIVE);

            verify(feed, times(2)).latestRoundData();
        }

        @Test
        @DisplayName("Stable decimals above volatile plus feed decimals are a configuration error")
        void rejectsNegativeScalingExponent() {
            assertThrows(IllegalStateException.class, () -> adapter(27));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Price exactly at the heartbeat age is still fresh")
        void heartbeatBoundaryIsFresh() {
            latestRound(PRICE_2000, NOW - 3600);

            assertEquals(PRICE_2000, adapter(0).currentVolatileAssetPrice());
        }

        @Test
        @DisplayName("Price one second past the heartbeat is stale")
        void pastHeartbeatIsStale() {
            latestRound(PRICE_2000, NOW - 3601);

            OracleStaleException e = assertThrows(OracleStaleException.class,
                () -> adapter(0).currentVolatileAssetPrice());

            assertEquals("3601", e.getDetails().get("ageSeconds"));
            assertEquals(1.0, meterRegistry.counter("vault.oracle.rejections", "reason", "stale").count());
        }

        @Test
        @DisplayName("Peeking applies the same validation without recording a rejection")
        void peekDoesNotRecordRejection() {
            latestRound(PRICE_2000, NOW - 3601);
            PriceOracleAdapter adapter = adapter(0);

            assertThrows(OracleStaleException.class, adapter::peekVolatileAssetPrice);
            latestRound(BigInteger.ZERO, NOW);
            assertThrows(OracleCompromisedException.class, adapter::peekVolatileAssetPrice);

            assertTrue(meterRegistry.find("vault.oracle.rejections").counters().isEmpty());
        }

        @Test
        @DisplayName("Zero price is compromised")
        void zeroPriceIsCompromised() {
            latestRound(BigInteger.ZERO, NOW);

            assertThrows(OracleCompromisedException.class, () -> adapter(0).currentVolatileAssetPrice());
        }

        @Test
        @DisplayName("Negative price is compromised")
        void negativePriceIsCompromised() {
            latestRound(BigInteger.valueOf(-1), NOW);

            assertThrows(OracleCompromisedException.class, () -> adapter(0).currentVolatileAssetPrice());
        }

        @Test
        @DisplayName("Round that was never updated is compromised")
        void neverUpdatedIsCompromised() {
            latestRound(PRICE_2000, 0);

            OracleCompromisedException e = assertThrows(OracleCompromisedException.class,
                () -> adapter(0).currentVolatileAssetPrice());
            assertEquals("round never updated", e.getDetails().get("reason"));
        }

        @Test
        @DisplayName("Feed without rounds is compromised")
        void missingRoundIsCompromised() {
            when(feed.latestRoundData()).thenReturn(Optional.empty());

            assertThrows(OracleCompromisedException.class, () -> adapter(0).convertVolatileToStable(ONE_NATIVE));
        }

        @Test
        @DisplayName("Update time in the future is accepted")
        void futureUpdateIsAccepted() {
            latestRound(PRICE_2000, NOW + 30);

            assertEquals(PRICE_2000, adapter(0).currentVolatileAssetPrice());
        }
    }
}
