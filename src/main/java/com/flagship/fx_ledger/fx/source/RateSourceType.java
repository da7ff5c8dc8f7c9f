package com.flagship.fx_ledger.fx.source;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The closed set of rate source adapters.
 */
@Getter
@RequiredArgsConstructor
public enum RateSourceType {
    EXCHANGE_RATES_API("ExchangeRates API"),
    FIXER("Fixer API");

    private final String displayName;
}
