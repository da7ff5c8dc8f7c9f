package com.flagship.fx_ledger.fx;

import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.fx.fallback.FallbackRateTable;
import com.flagship.fx_ledger.observability.FxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;

/**
 * Resolves the rate to apply for a currency pair.
 *
 * Live path:
 * 1. Look up the cached rate table for the base currency
 * 2. On a miss, fetch it from the live provider under the retry policy
 *    (3 attempts, 1s → 2s → capped at 5s) and cache it
 * 3. Read the target currency from the table
 *
 * A missing target currency or an exhausted retry budget fails with
 * {@link RateUnavailableException}. The fallback table is consulted only
 * when the caller passes {@link RatePreference#ALLOW_FALLBACK}.
 */
@Service
@Slf4j
public class RateResolver {

    private final RateCache cache;
    private final LiveRateProvider provider;
    private final RetryPolicy retryPolicy;
    private final FallbackRateTable fallbackTable;
    private final FxMetrics metrics;
    private final Clock clock;

    public RateResolver(RateCache cache,
                        LiveRateProvider provider,
                        RetryPolicy retryPolicy,
                        FallbackRateTable fallbackTable,
                        FxMetrics metrics,
                        Clock clock) {
        this.cache = cache;
        this.provider = provider;
        this.retryPolicy = retryPolicy;
        this.fallbackTable = fallbackTable;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Live rate table for a base currency, from cache or the provider.
     *
     * @throws RateUnavailableException if the provider failed on every attempt
     */
    public ExchangeRateTable getRates(CurrencyCode base) {
        Optional<ExchangeRateTable> cached = cache.get(base);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            log.debug("Cache hit for rates: {}", base);
            return cached.get();
        }
        metrics.recordCacheMiss();
        log.debug("Cache miss for rates: {}. Fetching from provider", base);

        ExchangeRateTable table;
        try {
            table = retryPolicy.execute("live-rates", () -> {
                try {
                    ExchangeRateTable fetched = provider.fetchRates(base);
                    metrics.recordFetch("success");
                    return fetched;
                } catch (RuntimeException e) {
                    metrics.recordFetch("failure");
                    throw e;
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to fetch rates for {}: {}", base, e.getMessage());
            throw new RateUnavailableException("Exchange rates for " + base + " are unavailable", e);
        }

        cache.put(table);
        log.debug("Fetched and cached {} rates for {}", table.getRates().size(), base);
        return table;
    }

    public RateQuote resolveRate(CurrencyCode from, CurrencyCode to) {
        return resolveRate(from, to, RatePreference.LIVE_ONLY);
    }

    /**
     * Rate for {@code from → to}.
     *
     * @throws RateUnavailableException if no rate is available under the given preference
     */
    public RateQuote resolveRate(CurrencyCode from, CurrencyCode to, RatePreference preference) {
        if (from == to) {
            return new RateQuote(from, to, BigDecimal.ONE, RateSourceKind.LIVE, clock.instant());
        }
        try {
            return resolveLive(from, to);
        } catch (RateUnavailableException e) {
            if (preference != RatePreference.ALLOW_FALLBACK) {
                throw e;
            }
            return resolveFallback(from, to, e);
        }
    }

    /**
     * Quote for converting {@code amount} from one currency into another on
     * the live path.
     */
    public Conversion convert(CurrencyCode from, CurrencyCode to, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be greater than zero");
        }
        RateQuote quote = resolveRate(from, to);
        return Conversion.of(from, to, amount, quote.getRate());
    }

    private RateQuote resolveLive(CurrencyCode from, CurrencyCode to) {
        ExchangeRateTable table = getRates(from);
        BigDecimal rate = table.rateFor(to).orElseThrow(() -> {
            log.warn("Exchange rate not found for {} -> {}", from, to);
            return new RateUnavailableException("Exchange rate not available for " + from + " -> " + to);
        });
        if (rate.signum() <= 0) {
            log.warn("Live provider returned non-positive rate for {} -> {}: {}", from, to, rate);
            throw new RateUnavailableException("Invalid live rate for " + from + " -> " + to);
        }
        return new RateQuote(from, to, rate, RateSourceKind.LIVE, table.getFetchedAt());
    }

    private RateQuote resolveFallback(CurrencyCode from, CurrencyCode to, RateUnavailableException cause) {
        RatePoint point = fallbackTable.get(from, to);
        log.warn("Serving fallback rate for {} -> {} ({} as of {}): {}",
                from, to, point.getRate(), point.getLastUpdated(), cause.getMessage());
        metrics.recordFallbackServed();
        return new RateQuote(from, to, point.getRate(), RateSourceKind.FALLBACK, point.getLastUpdated());
    }
}
