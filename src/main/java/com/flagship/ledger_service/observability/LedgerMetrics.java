package com.flagship.ledger_service.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations: Counter of finished operations, tagged by operation and outcome
 * - ledger.operation.latency: Timer per operation
 * - ledger.retries: Counter of transient failures that triggered a retry
 * - ledger.lock.timeouts: Counter of lock acquisitions that gave up
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOutcome(String operation, String outcome) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public <T> T time(String operation, Supplier<T> work) {
        Timer timer = registry.timer("ledger.operation.latency", "operation", sanitizeTag(operation));
        return timer.record(work);
    }

    public void recordRetry(String operation) {
        registry.counter("ledger.retries", "operation", sanitizeTag(operation)).increment();
    }

    public void recordLockTimeout() {
        registry.counter("ledger.lock.timeouts").increment();
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
