package com.flagship.fx_ledger.fx.fallback;

import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.fx.RatePoint;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Hardcoded rates the fallback table starts from. One direction per pair;
 * the table derives the inverse.
 */
public final class BaselineRates {

    public static final String SOURCE = "baseline";

    private BaselineRates() {
    }

    public static List<RatePoint> at(Instant instant) {
        return List.of(
            point(CurrencyCode.NGN, CurrencyCode.USD, "0.0021", instant),
            point(CurrencyCode.NGN, CurrencyCode.EUR, "0.0019", instant),
            point(CurrencyCode.NGN, CurrencyCode.GBP, "0.0016", instant),
            point(CurrencyCode.USD, CurrencyCode.EUR, "0.92", instant),
            point(CurrencyCode.USD, CurrencyCode.GBP, "0.79", instant),
            point(CurrencyCode.EUR, CurrencyCode.GBP, "0.86", instant)
        );
    }

    private static RatePoint point(CurrencyCode from, CurrencyCode to, String rate, Instant instant) {
        return new RatePoint(from, to, new BigDecimal(rate), instant, SOURCE);
    }
}
