package com.flagship.fx_ledger.ledger;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Tracks the state of a single ledger operation attempt.
 *
 * Instances are confined to the thread running the operation. The state moves
 * from the caller's thread into the hold callback and back, so it is mutable
 * rather than copied on every transition.
 */
@Getter
@Slf4j
public class LedgerOperation {

    private final UUID entryId;
    private final EntryKind kind;
    private LedgerOperationState state = LedgerOperationState.STARTED;
    @Getter(AccessLevel.NONE)
    private boolean reachedHold;

    public LedgerOperation(UUID entryId, EntryKind kind) {
        this.entryId = entryId;
        this.kind = kind;
    }

    public void held() {
        moveTo(LedgerOperationState.HELD);
    }

    public void mutated() {
        moveTo(LedgerOperationState.MUTATED);
    }

    public void persisted() {
        moveTo(LedgerOperationState.PERSISTED);
    }

    /**
     * Aborts the attempt. Aborting an already aborted attempt is a no-op.
     *
     * @throws IllegalStateException if the attempt was already persisted
     */
    public void aborted() {
        if (state == LedgerOperationState.ABORTED) {
            return;
        }
        moveTo(LedgerOperationState.ABORTED);
    }

    /**
     * True if the attempt got past hold acquisition before it ended.
     */
    public boolean reachedHold() {
        return reachedHold;
    }

    private void moveTo(LedgerOperationState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                "Cannot move %s operation %s from %s to %s", kind, entryId, state, target));
        }
        log.debug("{} operation {}: {} -> {}", kind, entryId, state, target);
        if (target == LedgerOperationState.HELD) {
            reachedHold = true;
        }
        state = target;
    }
}
