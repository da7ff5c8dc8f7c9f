package com.flagship.fx_ledger.fx.source;

public class RateSourceException extends RuntimeException {

    public RateSourceException(String message) {
        super(message);
    }

    public RateSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
