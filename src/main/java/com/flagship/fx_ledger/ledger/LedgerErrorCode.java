package com.flagship.fx_ledger.ledger;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure codes reported by ledger operations.
 *
 * Each code belongs to one category of the error taxonomy and states whether a
 * caller may retry the whole operation. No code ever implies a partial commit.
 */
@Getter
@RequiredArgsConstructor
public enum LedgerErrorCode {
    INVALID_AMOUNT(Category.VALIDATION, false),
    UNSUPPORTED_CURRENCY(Category.VALIDATION, false),
    SAME_OWNER(Category.VALIDATION, false),
    INVALID_RECIPIENT(Category.VALIDATION, false),
    SAME_CURRENCY(Category.VALIDATION, false),
    OWNER_NOT_ELIGIBLE(Category.ELIGIBILITY, false),
    INSUFFICIENT_FUNDS(Category.STATE, false),
    RATE_UNAVAILABLE(Category.DEPENDENCY, true),
    STORAGE_UNAVAILABLE(Category.DEPENDENCY, true),
    INTERNAL(Category.FATAL, false);

    private final Category category;
    private final boolean retryable;

    /**
     * Rejected before any hold is acquired.
     */
    public boolean isRejectedBeforeHold() {
        return category == Category.VALIDATION || category == Category.ELIGIBILITY;
    }

    public enum Category {
        VALIDATION,
        ELIGIBILITY,
        STATE,
        DEPENDENCY,
        FATAL
    }
}
