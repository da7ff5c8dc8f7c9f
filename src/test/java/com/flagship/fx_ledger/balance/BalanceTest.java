package com.flagship.fx_ledger.balance;

import com.flagship.fx_ledger.currency.CurrencyCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the Balance value and its key ordering.
 */
class BalanceTest {

    private static final BalanceKey KEY = BalanceKey.of("owner-1", CurrencyCode.USD);

    @Test
    @DisplayName("Zero balance has every field at zero with balance precision")
    void testZero() {
        Balance balance = Balance.zero(KEY);

        assertEquals(new BigDecimal("0.00000000"), balance.getTotal());
        assertEquals(new BigDecimal("0.00000000"), balance.getLocked());
        assertEquals(new BigDecimal("0.00000000"), balance.getAvailable());
        assertEquals("owner-1", balance.getOwnerId());
        assertEquals(CurrencyCode.USD, balance.getCurrency());
    }

    @Test
    @DisplayName("Credit and debit keep total = locked + available")
    void testCreditDebit() {
        Balance balance = Balance.zero(KEY)
            .credit(new BigDecimal("100.5"))
            .debit(new BigDecimal("0.5"));

        assertEquals(new BigDecimal("100.00000000"), balance.getTotal());
        assertEquals(new BigDecimal("100.00000000"), balance.getAvailable());
        assertEquals(balance.getTotal(), balance.getLocked().add(balance.getAvailable()));
    }

    @Test
    @DisplayName("Debit below zero violates the invariant")
    void testDebit_Overdraw() {
        Balance balance = Balance.zero(KEY).credit(BigDecimal.TEN);

        assertThrows(IllegalStateException.class, () -> balance.debit(new BigDecimal("10.00000001")));
    }

    @Test
    @DisplayName("Non-positive amounts are rejected")
    void testNonPositiveAmounts() {
        Balance balance = Balance.zero(KEY);

        assertThrows(IllegalArgumentException.class, () -> balance.credit(BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> balance.debit(new BigDecimal("-1")));
        assertThrows(IllegalArgumentException.class, () -> balance.credit(null));
    }

    @Test
    @DisplayName("Inconsistent fields are rejected on construction")
    void testConstruction_InvariantChecked() {
        Instant now = Instant.now();

        assertThrows(IllegalStateException.class,
            () -> new Balance(KEY, BigDecimal.TEN, BigDecimal.ONE, BigDecimal.ONE, now));
        assertThrows(IllegalStateException.class,
            () -> new Balance(KEY, BigDecimal.ZERO, BigDecimal.ONE, new BigDecimal("-1"), now));
    }

    @Test
    @DisplayName("Totals are capped at 12 integer digits")
    void testMaxAmount() {
        Balance full = Balance.zero(KEY).credit(Balance.MAX_AMOUNT);

        assertFalse(full.canAccept(new BigDecimal("0.00000001")));
        assertTrue(Balance.zero(KEY).canAccept(Balance.MAX_AMOUNT));
        assertThrows(IllegalStateException.class, () -> full.credit(new BigDecimal("0.00000001")));
        assertEquals(Balance.INTEGER_DIGITS,
            Balance.MAX_AMOUNT.precision() - Balance.MAX_AMOUNT.scale());
    }

    @Test
    @DisplayName("Amounts are rounded half-even to 8 decimals")
    void testScale() {
        assertEquals(new BigDecimal("0.12345678"), Balance.scale(new BigDecimal("0.123456785")));
        assertEquals(new BigDecimal("0.12345680"), Balance.scale(new BigDecimal("0.123456795")));
    }

    @Test
    @DisplayName("Keys order by owner id, then currency code")
    void testKeyCanonicalOrder() {
        TreeSet<BalanceKey> keys = new TreeSet<>(List.of(
            BalanceKey.of("b", CurrencyCode.EUR),
            BalanceKey.of("a", CurrencyCode.USD),
            BalanceKey.of("a", CurrencyCode.EUR)));

        assertEquals(List.of(
            BalanceKey.of("a", CurrencyCode.EUR),
            BalanceKey.of("a", CurrencyCode.USD),
            BalanceKey.of("b", CurrencyCode.EUR)), List.copyOf(keys));
    }

    @Test
    @DisplayName("Keys require an owner and a currency")
    void testKeyValidation() {
        assertThrows(IllegalArgumentException.class, () -> BalanceKey.of(" ", CurrencyCode.USD));
        assertThrows(NullPointerException.class, () -> BalanceKey.of("owner", null));
    }
}
