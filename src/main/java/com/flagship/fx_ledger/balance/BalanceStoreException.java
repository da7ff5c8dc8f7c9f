package com.flagship.fx_ledger.balance;

import lombok.Getter;

/**
 * Storage-layer failure of the balance store.
 *
 * Retryable failures (connection loss, serialization conflicts, lock timeouts)
 * may be retried by the caller as a whole operation. Non-retryable failures
 * indicate a corrupt or inconsistent store.
 */
@Getter
public class BalanceStoreException extends RuntimeException {

    private final boolean retryable;

    public BalanceStoreException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }
}
