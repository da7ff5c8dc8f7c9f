package com.flagship.fx_ledger.fx.fallback;

import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.fx.RatePoint;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Process-wide matrix of fallback rates.
 *
 * Every supported pair has an entry at all times, and both directions of a
 * pair are always stored consistently: writing A → B with rate R also writes
 * B → A with rate 1 / R. Reads never block; each entry is replaced atomically.
 */
public interface FallbackRateTable {

    /**
     * Current rate for the pair. A pair of identical currencies yields rate 1.
     */
    RatePoint get(CurrencyCode from, CurrencyCode to);

    /**
     * Writes the point and its exact inverse.
     */
    void update(RatePoint point);

    List<RatePoint> snapshot();

    boolean hasStaleEntries(Instant now, Duration maxAge);
}
