package com.flagship.fx_ledger.fx.fallback;

import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.fx.CurrencyPair;
import com.flagship.fx_ledger.fx.RatePoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryFallbackRateTableTest {

    private static final Instant SEEDED_AT = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryFallbackRateTable table;

    @BeforeEach
    void setUp() {
        table = new InMemoryFallbackRateTable(Clock.fixed(SEEDED_AT, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Every ordered pair of distinct currencies is seeded")
    void testSeededMatrix() {
        List<RatePoint> snapshot = table.snapshot();

        assertEquals(12, snapshot.size());
        for (CurrencyCode from : CurrencyCode.values()) {
            for (CurrencyCode to : CurrencyCode.values()) {
                RatePoint point = table.get(from, to);
                assertTrue(point.getRate().signum() > 0, from + "/" + to);
            }
        }
        assertEquals(0, new BigDecimal("0.92").compareTo(table.get(CurrencyCode.USD, CurrencyCode.EUR).getRate()));
        assertEquals(BaselineRates.SOURCE, table.get(CurrencyCode.NGN, CurrencyCode.GBP).getSource());
    }

    @Test
    @DisplayName("Identical currencies yield rate 1")
    void testIdentity() {
        assertEquals(BigDecimal.ONE, table.get(CurrencyCode.GBP, CurrencyCode.GBP).getRate());
    }

    @Test
    @DisplayName("Seeded inverses are exact reciprocals")
    void testSeededReciprocity() {
        for (RatePoint point : table.snapshot()) {
            RatePoint inverse = table.get(point.getTo(), point.getFrom());
            BigDecimal product = point.getRate().multiply(inverse.getRate(), MathContext.DECIMAL64);
            assertEquals(0, BigDecimal.ONE.compareTo(product), point.pair() + " x " + inverse.pair());
        }
    }

    @Test
    @DisplayName("Update writes both directions with the same timestamp")
    void testUpdate_WritesInverse() {
        Instant refreshedAt = SEEDED_AT.plusSeconds(60);
        BigDecimal rate = new BigDecimal("0.95");

        table.update(new RatePoint(CurrencyCode.USD, CurrencyCode.EUR, rate, refreshedAt, "test"));

        RatePoint forward = table.get(CurrencyCode.USD, CurrencyCode.EUR);
        RatePoint inverse = table.get(CurrencyCode.EUR, CurrencyCode.USD);
        assertEquals(rate, forward.getRate());
        assertEquals(BigDecimal.ONE.divide(rate, MathContext.DECIMAL128), inverse.getRate());
        assertEquals(refreshedAt, forward.getLastUpdated());
        assertEquals(refreshedAt, inverse.getLastUpdated());
        assertEquals(12, table.snapshot().size());
    }

    @Test
    @DisplayName("Readers never see a pair next to a stale inverse while updates run")
    void testUpdate_PairAndInversePublishedTogether() throws Exception {
        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicInteger torn = new AtomicInteger();
        AtomicInteger reads = new AtomicInteger();
        Thread reader = new Thread(() -> {
            do {
                Map<CurrencyPair, RatePoint> byPair = table.snapshot().stream()
                    .collect(Collectors.toMap(RatePoint::pair, Function.identity()));
                RatePoint forward = byPair.get(CurrencyPair.of(CurrencyCode.USD, CurrencyCode.EUR));
                RatePoint inverse = byPair.get(CurrencyPair.of(CurrencyCode.EUR, CurrencyCode.USD));
                if (!forward.getLastUpdated().equals(inverse.getLastUpdated())) {
                    torn.incrementAndGet();
                }
                reads.incrementAndGet();
            } while (writing.get());
        });
        reader.start();

        for (int i = 1; i <= 5_000; i++) {
            table.update(new RatePoint(CurrencyCode.USD, CurrencyCode.EUR,
                new BigDecimal("0.90").add(BigDecimal.valueOf(i, 6)), SEEDED_AT.plusSeconds(i), "test"));
        }
        writing.set(false);
        reader.join();

        assertTrue(reads.get() > 0);
        assertEquals(0, torn.get());
        assertEquals(SEEDED_AT.plusSeconds(5_000), table.get(CurrencyCode.EUR, CurrencyCode.USD).getLastUpdated());
    }

    @Test
    @DisplayName("Invalid points are refused")
    void testUpdate_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> table.update(
            new RatePoint(CurrencyCode.USD, CurrencyCode.USD, BigDecimal.ONE, SEEDED_AT, "test")));
        assertThrows(IllegalArgumentException.class, () -> table.update(
            new RatePoint(CurrencyCode.USD, CurrencyCode.EUR, BigDecimal.ZERO, SEEDED_AT, "test")));
        assertEquals(0, new BigDecimal("0.92").compareTo(table.get(CurrencyCode.USD, CurrencyCode.EUR).getRate()));
    }

    @Test
    @DisplayName("Entries become stale strictly after the max age")
    void testStaleness() {
        Duration maxAge = Duration.ofHours(1);

        assertFalse(table.hasStaleEntries(SEEDED_AT.plus(maxAge), maxAge));
        assertTrue(table.hasStaleEntries(SEEDED_AT.plus(maxAge).plusMillis(1), maxAge));
    }
}
