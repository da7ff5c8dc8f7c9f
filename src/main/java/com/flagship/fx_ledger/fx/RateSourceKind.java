package com.flagship.fx_ledger.fx;

/**
 * Where a resolved rate came from.
 */
public enum RateSourceKind {
    LIVE,
    FALLBACK
}
