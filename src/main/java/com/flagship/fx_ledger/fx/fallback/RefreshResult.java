package com.flagship.fx_ledger.fx.fallback;

import com.flagship.fx_ledger.fx.source.RateSourceType;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a successful refresh cycle.
 */
@Value
public class RefreshResult {
    RateSourceType source;
    int pairsUpdated;
    int rejectedRates;
    int significantChanges;
    Instant refreshedAt;
}
