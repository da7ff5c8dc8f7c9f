package com.flagship.fx_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Metrics for rate resolution and the fallback refresh cycle.
 */
@Component
public class FxMetrics {

    private final MeterRegistry registry;

    public FxMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCacheHit() {
        registry.counter("fx.rate.cache", "result", "hit").increment();
    }

    public void recordCacheMiss() {
        registry.counter("fx.rate.cache", "result", "miss").increment();
    }

    /**
     * One count per live fetch attempt, {@code success} or {@code failure}.
     */
    public void recordFetch(String status) {
        registry.counter("fx.rate.fetch", "status", LedgerMetrics.sanitizeTag(status)).increment();
    }

    public void recordFallbackServed() {
        registry.counter("fx.rate.fallback_served").increment();
    }

    public void recordRefresh(String status, String source) {
        registry.counter("fx.fallback.refresh",
                "status", LedgerMetrics.sanitizeTag(status),
                "source", LedgerMetrics.sanitizeTag(source)
        ).increment();
    }

    public void recordSignificantChange(String pair) {
        registry.counter("fx.fallback.significant_change", "pair", LedgerMetrics.sanitizeTag(pair)).increment();
    }

    public void recordInvalidRate(String source) {
        registry.counter("fx.fallback.invalid_rate", "source", LedgerMetrics.sanitizeTag(source)).increment();
    }
}
