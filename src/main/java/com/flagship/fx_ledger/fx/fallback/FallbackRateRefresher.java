package com.flagship.fx_ledger.fx.fallback;

import com.flagship.fx_ledger.fx.CurrencyPair;
import com.flagship.fx_ledger.fx.FxProperties;
import com.flagship.fx_ledger.fx.RatePoint;
import com.flagship.fx_ledger.fx.RetryPolicy;
import com.flagship.fx_ledger.fx.source.RateSource;
import com.flagship.fx_ledger.fx.source.RateSourceChain;
import com.flagship.fx_ledger.observability.FxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Refreshes the fallback table from the rate source chain.
 *
 * A cycle walks the sources in priority order and stops at the first one that
 * yields at least one valid rate. Rates from different sources are never
 * merged. Validation runs over the whole batch before anything is written, so
 * a failing cycle leaves the table exactly as it was.
 *
 * Validation rules:
 * - rate > 0 and rate < {@code fx.fallback.max-rate}
 * - one rate per unordered pair; the first one a source reports wins and the
 *   other direction is derived from it
 *
 * Rate changes above {@code fx.fallback.significant-change-percent} are logged
 * and counted but still applied.
 */
@Service
@Slf4j
public class FallbackRateRefresher {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RateSourceChain chain;
    private final FallbackRateTable table;
    private final RetryPolicy retryPolicy;
    private final FxMetrics metrics;
    private final FxProperties.Fallback settings;
    private final Clock clock;

    public FallbackRateRefresher(RateSourceChain chain,
                                 FallbackRateTable table,
                                 RetryPolicy retryPolicy,
                                 FxMetrics metrics,
                                 FxProperties properties,
                                 Clock clock) {
        this.chain = chain;
        this.table = table;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.settings = properties.getFallback();
        this.clock = clock;
    }

    /**
     * Refreshes the table if any entry is older than {@code fx.fallback.max-age}.
     * The cycle runs under the rate retry policy.
     *
     * @return the result of the refresh, or empty if nothing was stale
     * @throws RateRefreshException if every attempt failed
     */
    public Optional<RefreshResult> refreshIfStale() {
        if (!table.hasStaleEntries(clock.instant(), settings.getMaxAge())) {
            log.debug("Fallback rates are fresh, skipping refresh");
            return Optional.empty();
        }
        log.info("Fallback rates are stale, refreshing");
        return Optional.of(retryPolicy.execute("fallback-refresh", this::refresh));
    }

    /**
     * Runs one refresh cycle unconditionally.
     *
     * @throws RateRefreshException if no source produced valid rates
     */
    public RefreshResult refresh() {
        RuntimeException lastError = null;

        for (RateSource source : chain.sources()) {
            String name = source.type().getDisplayName();

            if (!source.isAvailable()) {
                log.warn("{} is not available, trying next source", name);
                metrics.recordRefresh("skipped", name);
                continue;
            }

            try {
                List<RatePoint> fetched = source.getRates();
                List<RatePoint> accepted = validate(fetched, name);
                if (accepted.isEmpty()) {
                    log.warn("{} returned no valid rates ({} received), trying next source", name, fetched.size());
                    metrics.recordRefresh("invalid", name);
                    lastError = new IllegalStateException(name + " returned no valid rates");
                    continue;
                }

                RefreshResult result = apply(source, accepted, fetched.size() - accepted.size());
                metrics.recordRefresh("success", name);
                log.info("Updated {} fallback rate pairs from {} ({} rejected, {} significant changes)",
                        result.getPairsUpdated(), name, result.getRejectedRates(), result.getSignificantChanges());
                return result;

            } catch (RuntimeException e) {
                log.error("Failed to fetch rates from {}: {}", name, e.getMessage());
                metrics.recordRefresh("failure", name);
                lastError = e;
            }
        }

        log.error("All rate sources failed, fallback table left unchanged");
        throw new RateRefreshException("All rate sources failed", lastError);
    }

    private List<RatePoint> validate(List<RatePoint> fetched, String sourceName) {
        List<RatePoint> accepted = new ArrayList<>();
        Set<CurrencyPair> seen = new HashSet<>();

        for (RatePoint point : fetched) {
            if (point.pair().isIdentity()) {
                continue;
            }
            if (!isValidRate(point.getRate())) {
                log.warn("Invalid rate from {} for {}: {}", sourceName, point.pair(), point.getRate());
                metrics.recordInvalidRate(sourceName);
                continue;
            }
            if (seen.contains(point.pair()) || seen.contains(point.pair().inverse())) {
                continue;
            }
            seen.add(point.pair());
            accepted.add(point);
        }
        return accepted;
    }

    private RefreshResult apply(RateSource source, List<RatePoint> accepted, int rejected) {
        Instant now = clock.instant();
        int significantChanges = 0;

        for (RatePoint point : accepted) {
            RatePoint current = table.get(point.getFrom(), point.getTo());
            if (isSignificantChange(current.getRate(), point.getRate())) {
                significantChanges++;
                log.warn("Significant market rate change detected for {}: {} -> {}",
                        point.pair(), current.getRate(), point.getRate());
                metrics.recordSignificantChange(point.pair().toString());
            }
            table.update(point.stampedAt(now));
            log.debug("Updated fallback rate {} = {}", point.pair(), point.getRate());
        }
        return new RefreshResult(source.type(), accepted.size(), rejected, significantChanges, now);
    }

    boolean isValidRate(BigDecimal rate) {
        return rate != null && rate.signum() > 0 && rate.compareTo(settings.getMaxRate()) < 0;
    }

    boolean isSignificantChange(BigDecimal oldRate, BigDecimal newRate) {
        BigDecimal changePercent = newRate.subtract(oldRate)
            .divide(oldRate, MathContext.DECIMAL64)
            .multiply(HUNDRED)
            .abs();
        return changePercent.compareTo(settings.getSignificantChangePercent()) > 0;
    }
}
