package com.flagship.fx_ledger.fx;

import com.flagship.fx_ledger.currency.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;

/**
 * A single directional exchange rate with its provenance.
 *
 * Immutable, so replacing a point in a shared map is atomic: a reader sees
 * either the old rate and timestamp or the new ones, never a mix.
 */
@Value
public class RatePoint {
    CurrencyCode from;
    CurrencyCode to;
    BigDecimal rate;
    Instant lastUpdated;
    String source;

    public CurrencyPair pair() {
        return CurrencyPair.of(from, to);
    }

    /**
     * The opposite direction with rate {@code 1 / rate}.
     */
    public RatePoint inverse() {
        return new RatePoint(to, from, BigDecimal.ONE.divide(rate, MathContext.DECIMAL128), lastUpdated, source);
    }

    /**
     * The same rate re-stamped with a new update time.
     */
    public RatePoint stampedAt(Instant instant) {
        return new RatePoint(from, to, rate, instant, source);
    }

    public boolean isStale(Instant now, Duration maxAge) {
        return Duration.between(lastUpdated, now).compareTo(maxAge) > 0;
    }
}
