package com.flagship.fx_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations{kind,status}: completed, rejected and aborted operations
 * - ledger.operation.duration{kind}: end-to-end operation latency
 * - ledger.notifications{status}: notification deliveries
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the outcome of one operation. {@code status} is
     * {@code completed} or the lower-cased error code.
     */
    public void recordOperation(String kind, String status, Duration duration) {
        registry.counter("ledger.operations",
                "kind", sanitizeTag(kind),
                "status", sanitizeTag(status)
        ).increment();

        Timer.builder("ledger.operation.duration")
                .description("Time taken by a ledger operation")
                .tag("kind", sanitizeTag(kind))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    public void recordNotificationSent() {
        registry.counter("ledger.notifications", "status", "sent").increment();
    }

    public void recordNotificationFailed() {
        registry.counter("ledger.notifications", "status", "failed").increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    static String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
