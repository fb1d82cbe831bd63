package com.flagship.vault_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for vault operations.
 *
 * Metrics exposed:
 * - vault.deposits: deposits by asset and outcome
 * - vault.withdrawals: withdrawals by asset and outcome
 * - vault.operation.latency: timer per operation
 * - vault.oracle.rejections: price reads rejected as stale or compromised
 * - vault.admin.changes: administrative parameter changes
 *
 * Outcome tags are either "success" or the lower-cased error code.
 */
@Component
public class VaultMetrics {

    private final MeterRegistry registry;

    public VaultMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDeposit(String asset, String outcome) {
        registry.counter("vault.deposits",
                "asset", sanitizeTag(asset),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordWithdrawal(String asset, String outcome) {
        registry.counter("vault.withdrawals",
                "asset", sanitizeTag(asset),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordOperationLatency(String operation, long durationMs) {
        registry.timer("vault.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordOracleRejection(String reason) {
        registry.counter("vault.oracle.rejections", "reason", sanitizeTag(reason)).increment();
    }

    public void recordAdminChange(String parameter) {
        registry.counter("vault.admin.changes", "parameter", sanitizeTag(parameter)).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
