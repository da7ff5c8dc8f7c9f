package com.flagship.fx_ledger.ledger;

/**
 * Lifecycle of one ledger operation attempt.
 *
 * STARTED → HELD → MUTATED → PERSISTED, with ABORTED reachable from any
 * non-terminal state. PERSISTED and ABORTED are terminal.
 */
public enum LedgerOperationState {
    STARTED,
    HELD,
    MUTATED,
    PERSISTED,
    ABORTED;

    public boolean isTerminal() {
        return this == PERSISTED || this == ABORTED;
    }

    public boolean canTransitionTo(LedgerOperationState target) {
        return switch (this) {
            case STARTED -> target == HELD || target == ABORTED;
            case HELD -> target == MUTATED || target == ABORTED;
            case MUTATED -> target == PERSISTED || target == ABORTED;
            case PERSISTED, ABORTED -> false;
        };
    }
}
