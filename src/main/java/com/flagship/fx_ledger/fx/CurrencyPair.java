package com.flagship.fx_ledger.fx;

import com.flagship.fx_ledger.currency.CurrencyCode;
import lombok.Value;

/**
 * Directional currency pair.
 */
@Value
public class CurrencyPair {
    CurrencyCode from;
    CurrencyCode to;

    public static CurrencyPair of(CurrencyCode from, CurrencyCode to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Both currencies are required");
        }
        return new CurrencyPair(from, to);
    }

    public CurrencyPair inverse() {
        return new CurrencyPair(to, from);
    }

    public boolean isIdentity() {
        return from == to;
    }

    @Override
    public String toString() {
        return from + "/" + to;
    }
}
