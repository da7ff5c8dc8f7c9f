package com.flagship.fx_ledger.fx;

import com.flagship.fx_ledger.currency.CurrencyCode;

import java.util.Optional;

/**
 * Short-lived cache of live rate tables, keyed by base currency.
 *
 * Cache failures behave like misses; implementations never throw.
 */
public interface RateCache {

    Optional<ExchangeRateTable> get(CurrencyCode base);

    void put(ExchangeRateTable table);
}
