package com.flagship.fx_ledger.currency;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Currency catalog following ISO-4217 codes.
 *
 * This is the closed set of currencies the wallet supports. Any other code is
 * rejected at the API boundary and never reaches the ledger.
 */
public enum CurrencyCode {
    NGN, // Nigerian Naira
    USD, // US Dollar
    EUR, // Euro
    GBP; // British Pound

    /**
     * Looks up a supported currency without throwing.
     */
    public static Optional<CurrencyCode> find(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(c -> c.name().equals(normalized))
            .findFirst();
    }

    /**
     * Parses a currency code.
     *
     * @throws IllegalArgumentException if the code is not part of the catalog
     */
    public static CurrencyCode fromCode(String code) {
        return find(code).orElseThrow(() ->
            new IllegalArgumentException("Unsupported currency: " + code));
    }
}
