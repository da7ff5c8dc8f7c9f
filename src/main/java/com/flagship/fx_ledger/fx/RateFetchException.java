package com.flagship.fx_ledger.fx;

import lombok.Getter;

/**
 * A single fetch from a rate provider failed.
 *
 * Non-retryable failures (missing configuration, rejected credentials) stop
 * the retry loop immediately.
 */
@Getter
public class RateFetchException extends RuntimeException {

    private final boolean retryable;

    public RateFetchException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public RateFetchException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }
}
