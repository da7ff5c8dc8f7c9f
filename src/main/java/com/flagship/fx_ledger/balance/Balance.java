package com.flagship.fx_ledger.balance;

import com.flagship.fx_ledger.currency.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Holdings of one owner in one currency.
 *
 * Immutable value: every mutation returns a new Balance. Only the balance store
 * hands out mutated copies, and only inside an exclusive hold.
 *
 * Invariants (checked on construction):
 * - total = locked + available
 * - locked >= 0 and available >= 0
 * - total <= MAX_AMOUNT (12 integer digits, the width of the storage columns)
 */
@Value
public class Balance {

    /**
     * Fractional digits kept for every stored amount.
     */
    public static final int SCALE = 8;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;
    public static final int INTEGER_DIGITS = 12;
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("999999999999.99999999");

    BalanceKey key;
    BigDecimal total;
    BigDecimal locked;
    BigDecimal available;
    Instant updatedAt;

    public Balance(BalanceKey key, BigDecimal total, BigDecimal locked, BigDecimal available, Instant updatedAt) {
        this.key = key;
        this.total = scale(total);
        this.locked = scale(locked);
        this.available = scale(available);
        this.updatedAt = updatedAt;

        if (this.locked.signum() < 0 || this.available.signum() < 0) {
            throw new IllegalStateException(String.format(
                "Balance %s cannot be negative: locked=%s, available=%s", key, this.locked, this.available));
        }
        if (this.total.compareTo(this.locked.add(this.available)) != 0) {
            throw new IllegalStateException(String.format(
                "Balance %s violates total = locked + available: total=%s, locked=%s, available=%s",
                key, this.total, this.locked, this.available));
        }
        if (this.total.compareTo(MAX_AMOUNT) > 0) {
            throw new IllegalStateException(String.format(
                "Balance %s exceeds the maximum of %s: total=%s", key, MAX_AMOUNT.toPlainString(), this.total));
        }
    }

    /**
     * A freshly created balance with every field at zero.
     */
    public static Balance zero(BalanceKey key) {
        return new Balance(key, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, Instant.now());
    }

    public String getOwnerId() {
        return key.getOwnerId();
    }

    public CurrencyCode getCurrency() {
        return key.getCurrency();
    }

    /**
     * Adds funds to total and available.
     */
    public Balance credit(BigDecimal amount) {
        requirePositive(amount);
        return new Balance(key, total.add(amount), locked, available.add(amount), Instant.now());
    }

    /**
     * Removes funds from total and available.
     *
     * @throws IllegalStateException if available would go negative
     */
    public Balance debit(BigDecimal amount) {
        requirePositive(amount);
        return new Balance(key, total.subtract(amount), locked, available.subtract(amount), Instant.now());
    }

    public boolean canCover(BigDecimal amount) {
        return available.compareTo(amount) >= 0;
    }

    /**
     * Whether crediting {@code amount} keeps the total within {@link #MAX_AMOUNT}.
     */
    public boolean canAccept(BigDecimal amount) {
        return total.add(scale(amount)).compareTo(MAX_AMOUNT) <= 0;
    }

    public static BigDecimal scale(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        return amount.setScale(SCALE, ROUNDING);
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }
}
