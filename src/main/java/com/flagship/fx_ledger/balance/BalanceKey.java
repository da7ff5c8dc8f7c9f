package com.flagship.fx_ledger.balance;

import com.flagship.fx_ledger.currency.CurrencyCode;
import lombok.Value;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one balance: an (owner, currency) pair.
 *
 * The natural ordering (owner id, then currency code) is the canonical order in
 * which multi-key holds are acquired. Every store must lock keys in this order.
 */
@Value
public class BalanceKey implements Comparable<BalanceKey> {

    private static final Comparator<BalanceKey> CANONICAL_ORDER =
        Comparator.comparing(BalanceKey::getOwnerId)
            .thenComparing(key -> key.getCurrency().name());

    String ownerId;
    CurrencyCode currency;

    private BalanceKey(String ownerId, CurrencyCode currency) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id is required");
        }
        this.ownerId = ownerId;
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public static BalanceKey of(String ownerId, CurrencyCode currency) {
        return new BalanceKey(ownerId, currency);
    }

    @Override
    public int compareTo(BalanceKey other) {
        return CANONICAL_ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return ownerId + "/" + currency;
    }
}
