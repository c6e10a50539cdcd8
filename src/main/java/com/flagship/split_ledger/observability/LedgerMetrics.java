package com.flagship.split_ledger.observability;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger reporting and maintenance.
 *
 * Metrics exposed:
 * - ledger.reports: Counter of generated reports, tagged by basis and status
 * - ledger.roster.changes: Counter of participant/instrument changes, tagged by operation and status
 * - settlement.transfers: Distribution of transfer counts per settlement
 * - ledger.report.latency: Timer per operation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final DistributionSummary transfersPerSettlement;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.transfersPerSettlement = DistributionSummary.builder("settlement.transfers")
                .description("Number of transfers produced per settlement")
                .register(registry);
    }

    public void recordReport(String basis, String status) {
        registry.counter("ledger.reports",
                "basis", sanitizeTag(basis),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordRosterChange(String operation, String status) {
        registry.counter("ledger.roster.changes",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordTransfers(int transferCount) {
        transfersPerSettlement.record(transferCount);
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.report.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
