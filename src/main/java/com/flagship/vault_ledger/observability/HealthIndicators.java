package com.flagship.vault_ledger.observability;

import com.flagship.vault_ledger.exception.VaultException;
import com.flagship.vault_ledger.oracle.PriceOracleAdapter;
import com.flagship.vault_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Readiness checks exposed through the actuator health endpoint.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Down while the price feed is stale or compromised: volatile-asset
     * deposits and solvency reads fail until it recovers.
     */
    @Component("oracleHealth")
    public static class OracleHealthIndicator implements HealthIndicator {

        private final PriceOracleAdapter oracle;

        public OracleHealthIndicator(PriceOracleAdapter oracle) {
            this.oracle = oracle;
        }

        @Override
        public Health health() {
            try {
                return Health.up()
                        .withDetail("price", oracle.peekVolatileAssetPrice().toString())
                        .build();
            } catch (VaultException e) {
                return Health.down()
                        .withDetail("code", e.getCode().name())
                        .withDetails(e.getDetails())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
