package com.flagship.fx_ledger.fx;

/**
 * No trustworthy rate could be produced for a pair. Callers may retry later.
 */
public class RateUnavailableException extends RuntimeException {

    public RateUnavailableException(String message) {
        super(message);
    }

    public RateUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
