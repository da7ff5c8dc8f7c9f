package com.flagship.fx_ledger.balance;

import com.flagship.fx_ledger.ledger.EntryStatus;
import com.flagship.fx_ledger.ledger.LedgerEntry;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Working copy of held balances shared by the store implementations.
 *
 * Starts from the values read under the hold and stages every change. Stores
 * read {@link #dirtyBalances()} and {@link #recordedEntries()} on commit and
 * simply drop the instance on rollback.
 */
class StagedBalanceHold implements BalanceHold {

    private final Map<BalanceKey, Balance> working = new LinkedHashMap<>();
    private final Set<BalanceKey> dirty = new LinkedHashSet<>();
    private final List<LedgerEntry> entries = new ArrayList<>();

    StagedBalanceHold(Map<BalanceKey, Balance> held) {
        this.working.putAll(held);
    }

    @Override
    public Balance balance(BalanceKey key) {
        Balance balance = working.get(key);
        if (balance == null) {
            throw new IllegalArgumentException("Balance " + key + " is not part of this hold");
        }
        return balance;
    }

    @Override
    public Balance credit(BalanceKey key, BigDecimal amount) {
        return stage(balance(key).credit(amount));
    }

    @Override
    public Balance debit(BalanceKey key, BigDecimal amount) {
        Balance current = balance(key);
        if (!current.canCover(amount)) {
            throw new IllegalStateException(String.format(
                "Balance %s has %s available, cannot debit %s", key, current.getAvailable(), amount));
        }
        return stage(current.debit(amount));
    }

    @Override
    public LedgerEntry record(LedgerEntry entry) {
        if (entry.getStatus() != EntryStatus.COMPLETED) {
            throw new IllegalArgumentException(
                "Only COMPLETED entries are written with a balance mutation, got " + entry.getStatus());
        }
        entries.add(entry);
        return entry;
    }

    Map<BalanceKey, Balance> dirtyBalances() {
        Map<BalanceKey, Balance> changed = new LinkedHashMap<>();
        for (BalanceKey key : dirty) {
            changed.put(key, working.get(key));
        }
        return changed;
    }

    List<LedgerEntry> recordedEntries() {
        return Collections.unmodifiableList(entries);
    }

    private Balance stage(Balance updated) {
        working.put(updated.getKey(), updated);
        dirty.add(updated.getKey());
        return updated;
    }
}
