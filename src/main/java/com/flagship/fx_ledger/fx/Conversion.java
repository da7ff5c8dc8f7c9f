package com.flagship.fx_ledger.fx;

import com.flagship.fx_ledger.balance.Balance;
import com.flagship.fx_ledger.currency.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of converting an amount with a resolved rate.
 */
@Value
public class Conversion {
    CurrencyCode from;
    CurrencyCode to;
    BigDecimal requestedAmount;
    BigDecimal rate;
    BigDecimal convertedAmount;

    /**
     * {@code convertedAmount = amount * rate}, rounded to balance precision.
     */
    public static Conversion of(CurrencyCode from, CurrencyCode to, BigDecimal amount, BigDecimal rate) {
        return new Conversion(from, to, amount, rate, Balance.scale(amount.multiply(rate)));
    }
}
