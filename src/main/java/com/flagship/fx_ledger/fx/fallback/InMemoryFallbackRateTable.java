package com.flagship.fx_ledger.fx.fallback;

import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.fx.CurrencyPair;
import com.flagship.fx_ledger.fx.RatePoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fallback table held in memory for the life of the process.
 *
 * Seeded from {@link BaselineRates} at construction and afterwards written
 * only by the refresh cycle. Readers see an immutable map published through a
 * single volatile reference; each update copies it, replaces a pair and its
 * inverse, and publishes the copy, so no reader sees one direction without the
 * other.
 */
@Component
@Slf4j
public class InMemoryFallbackRateTable implements FallbackRateTable {

    private volatile Map<CurrencyPair, RatePoint> rates = Map.of();
    private final Clock clock;

    public InMemoryFallbackRateTable(Clock clock) {
        this.clock = clock;
        BaselineRates.at(clock.instant()).forEach(this::update);
        log.info("Fallback rate table seeded with {} baseline rates", rates.size());
    }

    @Override
    public RatePoint get(CurrencyCode from, CurrencyCode to) {
        CurrencyPair pair = CurrencyPair.of(from, to);
        if (pair.isIdentity()) {
            return new RatePoint(from, to, BigDecimal.ONE, clock.instant(), BaselineRates.SOURCE);
        }
        RatePoint point = rates.get(pair);
        if (point == null) {
            // Unreachable while every catalog pair is seeded
            throw new IllegalStateException("No fallback rate for " + pair);
        }
        return point;
    }

    @Override
    public synchronized void update(RatePoint point) {
        if (point.pair().isIdentity()) {
            throw new IllegalArgumentException("Cannot store a rate for identical currencies: " + point.pair());
        }
        if (point.getRate().signum() <= 0) {
            throw new IllegalArgumentException("Rate must be positive: " + point);
        }
        RatePoint inverse = point.inverse();
        Map<CurrencyPair, RatePoint> next = new HashMap<>(rates);
        next.put(point.pair(), point);
        next.put(inverse.pair(), inverse);
        rates = Map.copyOf(next);
    }

    @Override
    public List<RatePoint> snapshot() {
        return rates.values().stream()
            .sorted(Comparator.comparing((RatePoint p) -> p.getFrom().name())
                .thenComparing(p -> p.getTo().name()))
            .toList();
    }

    @Override
    public boolean hasStaleEntries(Instant now, Duration maxAge) {
        return rates.values().stream().anyMatch(point -> point.isStale(now, maxAge));
    }
}
