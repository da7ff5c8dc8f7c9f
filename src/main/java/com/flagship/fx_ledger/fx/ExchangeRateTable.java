package com.flagship.fx_ledger.fx;

import com.flagship.fx_ledger.currency.CurrencyCode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Full live rate table for one base currency, as fetched from the primary
 * provider and cached.
 */
@Value
@Builder
@Jacksonized
public class ExchangeRateTable {
    CurrencyCode base;
    @Singular
    Map<CurrencyCode, BigDecimal> rates;
    Instant fetchedAt;

    public Optional<BigDecimal> rateFor(CurrencyCode target) {
        if (target == base) {
            return Optional.of(BigDecimal.ONE);
        }
        return Optional.ofNullable(rates.get(target));
    }
}
