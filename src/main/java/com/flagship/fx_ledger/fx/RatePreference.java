package com.flagship.fx_ledger.fx;

/**
 * Caller's tolerance for degraded-accuracy pricing.
 */
public enum RatePreference {
    /** Fail when the live provider cannot answer. */
    LIVE_ONLY,
    /** Serve the fallback table when the live provider cannot answer. */
    ALLOW_FALLBACK
}
