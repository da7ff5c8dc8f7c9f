package com.flagship.fx_ledger.balance;

import java.time.Duration;
import java.util.Collection;

/**
 * Exclusive holds could not be acquired within the bounded wait.
 * Nothing was mutated; the caller may retry the whole operation.
 */
public class HoldTimeoutException extends BalanceStoreException {

    public HoldTimeoutException(Collection<BalanceKey> keys, Duration timeout, Throwable cause) {
        super(String.format("Could not acquire hold on %s within %d ms", keys, timeout.toMillis()), true, cause);
    }
}
