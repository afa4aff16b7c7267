package com.flagship.debt_settlement.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for settlement runs.
 *
 * Metrics exposed:
 * - settlement.runs: Counter of pipeline runs, tagged by outcome
 * - settlement.transfers: Counter of emitted transfers, tagged by currency and strategy
 * - settlement.duration: Timer for whole pipeline runs
 * - ledger.validation.issues: Counter of validation issues found
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    private final Timer runTimer;
    private final Counter validationIssues;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.runTimer = Timer.builder("settlement.duration")
                .description("Time taken to compute a settlement plan")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.validationIssues = Counter.builder("ledger.validation.issues")
                .description("Number of issues reported by ledger validation")
                .register(registry);
    }

    /**
     * Records a pipeline run with its outcome (success, rejected, cancelled, error).
     */
    public void recordRun(String outcome, long durationMs) {
        registry.counter("settlement.runs", "outcome", sanitizeTag(outcome)).increment();
        runTimer.record(Duration.ofMillis(durationMs));
    }

    /**
     * Records the transfers produced for one currency.
     */
    public void recordTransfers(String currency, String strategy, int count) {
        registry.counter("settlement.transfers",
                "currency", sanitizeTag(currency),
                "strategy", sanitizeTag(strategy)
        ).increment(count);
    }

    public void recordValidationIssues(int count) {
        validationIssues.increment(count);
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
