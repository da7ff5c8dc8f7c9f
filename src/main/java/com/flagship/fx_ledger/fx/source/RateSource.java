package com.flagship.fx_ledger.fx.source;

import com.flagship.fx_ledger.fx.RatePoint;

import java.util.List;

/**
 * Upstream provider of market rates used to refresh the fallback table.
 */
public interface RateSource {

    RateSourceType type();

    /**
     * Cheap liveness probe. Never throws.
     */
    boolean isAvailable();

    /**
     * Bulk fetch of every supported rate this source publishes. May include
     * both directions of a pair.
     *
     * @throws RateSourceException if the source cannot be queried or answers with garbage
     */
    List<RatePoint> getRates();
}
