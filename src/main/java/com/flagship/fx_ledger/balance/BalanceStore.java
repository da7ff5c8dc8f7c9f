package com.flagship.fx_ledger.balance;

import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.ledger.LedgerEntry;

import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Durable, concurrency-safe storage of balances and the ledger entries written
 * with them.
 *
 * The store is the only component that mutates balance fields. Mutation happens
 * exclusively through {@link #withExclusiveHold(Set, Function)}.
 */
public interface BalanceStore {

    /**
     * Returns the balance for the key, creating a zeroed one on first reference.
     * Idempotent; concurrent calls for the same key never create duplicates.
     */
    Balance getOrCreate(String ownerId, CurrencyCode currency);

    /**
     * All balances of one owner, ordered by currency.
     */
    List<Balance> findByOwner(String ownerId);

    /**
     * Runs {@code work} while holding exclusive access to every given key.
     *
     * Keys are acquired in canonical {@link BalanceKey} order regardless of the
     * order the caller supplies them in. On success, staged balance mutations and
     * recorded entries are persisted before the hold is released. If {@code work}
     * throws, nothing it staged is persisted and the exception propagates.
     *
     * @throws HoldTimeoutException if the keys cannot be acquired within the configured wait
     * @throws BalanceStoreException on storage failure; nothing is partially applied
     */
    <T> T withExclusiveHold(Set<BalanceKey> keys, Function<BalanceHold, T> work);

    /**
     * Appends a terminal entry outside of any hold. Used for FAILED entries,
     * which are written after the operation's mutations were rolled back.
     */
    LedgerEntry append(LedgerEntry entry);

    /**
     * Entries of one owner, newest first.
     */
    List<LedgerEntry> findEntries(String ownerId);
}
