package com.flagship.fx_ledger.fx.fallback;

/**
 * No rate source produced usable rates. The fallback table is left untouched.
 */
public class RateRefreshException extends RuntimeException {

    public RateRefreshException(String message, Throwable cause) {
        super(message, cause);
    }
}
