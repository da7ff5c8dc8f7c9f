package com.flagship.fx_ledger.ledger;

/**
 * Status of a ledger entry.
 *
 * PENDING exists only while an operation is in flight. COMPLETED and FAILED are
 * terminal: once written, an entry is never changed again.
 */
public enum EntryStatus {
    /**
     * Operation started, nothing persisted yet.
     */
    PENDING,

    /**
     * Balances were mutated and the entry committed with them.
     */
    COMPLETED,

    /**
     * Operation aborted after acquiring its holds. No balance was changed.
     */
    FAILED,

    /**
     * Operation withdrawn before any hold was taken.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
