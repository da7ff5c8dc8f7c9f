package com.flagship.fx_ledger.balance;

import com.flagship.fx_ledger.ledger.LedgerEntry;

import java.math.BigDecimal;

/**
 * Mutable view over the balances held by one exclusive hold.
 *
 * Mutations are staged: they become visible to other operations only when the
 * hold commits. If the work function throws, everything staged here is
 * discarded.
 */
public interface BalanceHold {

    /**
     * Current (staged) value of a held balance.
     *
     * @throws IllegalArgumentException if the key is not part of this hold
     */
    Balance balance(BalanceKey key);

    /**
     * Adds {@code amount} to total and available of a held balance.
     */
    Balance credit(BalanceKey key, BigDecimal amount);

    /**
     * Removes {@code amount} from total and available of a held balance.
     *
     * @throws IllegalStateException if the balance cannot cover the amount
     */
    Balance debit(BalanceKey key, BigDecimal amount);

    /**
     * Stages a ledger entry to be committed together with the balances.
     */
    LedgerEntry record(LedgerEntry entry);
}
