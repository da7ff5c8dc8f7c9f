package com.flagship.fx_ledger.fx;

import com.flagship.fx_ledger.currency.CurrencyCode;

/**
 * Primary external provider of live rate tables.
 */
public interface LiveRateProvider {

    /**
     * One fetch attempt, no retries.
     *
     * @throws RateFetchException if the provider cannot be reached or answers with garbage
     */
    ExchangeRateTable fetchRates(CurrencyCode base);
}
