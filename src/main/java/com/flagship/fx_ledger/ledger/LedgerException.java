package com.flagship.fx_ledger.ledger;

import lombok.Getter;

/**
 * Raised when a ledger operation is rejected or aborted.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode code;

    public LedgerException(LedgerErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public LedgerException(LedgerErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    public static LedgerException invalidAmount(Object amount) {
        return new LedgerException(LedgerErrorCode.INVALID_AMOUNT,
            "Amount must be greater than zero, got " + amount);
    }

    public static LedgerException notEligible(String ownerId) {
        return new LedgerException(LedgerErrorCode.OWNER_NOT_ELIGIBLE,
            "Owner " + ownerId + " is not eligible for ledger operations");
    }

    public static LedgerException insufficientFunds(Object key, Object available, Object requested) {
        return new LedgerException(LedgerErrorCode.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds in %s: available %s, requested %s", key, available, requested));
    }
}
