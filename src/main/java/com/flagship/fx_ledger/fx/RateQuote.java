package com.flagship.fx_ledger.fx;

import com.flagship.fx_ledger.currency.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class RateQuote {
    CurrencyCode from;
    CurrencyCode to;
    BigDecimal rate;
    RateSourceKind source;
    Instant asOf;

    public boolean isLive() {
        return source == RateSourceKind.LIVE;
    }
}
