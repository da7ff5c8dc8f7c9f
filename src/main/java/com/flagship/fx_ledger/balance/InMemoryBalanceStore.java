package com.flagship.fx_ledger.balance;

import com.flagship.fx_ledger.config.LedgerProperties;
import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.ledger.LedgerEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Process-local balance store backed by a key mutex table.
 *
 * Each balance key owns a {@link ReentrantLock}. Holds lock keys in canonical
 * order with a bounded {@code tryLock}, so a transfer A→B and a concurrent B→A
 * never deadlock. Balances are immutable values swapped in on commit, so a
 * reader never observes a half-written balance.
 *
 * Not durable across restarts. Selected with {@code ledger.balance-store=in-memory}.
 */
@Component
@ConditionalOnProperty(name = "ledger.balance-store", havingValue = "in-memory")
@Slf4j
public class InMemoryBalanceStore implements BalanceStore {

    private final Map<BalanceKey, Balance> balances = new ConcurrentHashMap<>();
    private final Map<BalanceKey, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, Deque<LedgerEntry>> entries = new ConcurrentHashMap<>();
    private final Duration holdTimeout;

    @Autowired
    public InMemoryBalanceStore(LedgerProperties properties) {
        this(properties.getHoldTimeout());
    }

    public InMemoryBalanceStore(Duration holdTimeout) {
        this.holdTimeout = holdTimeout;
    }

    @Override
    public Balance getOrCreate(String ownerId, CurrencyCode currency) {
        return balances.computeIfAbsent(BalanceKey.of(ownerId, currency), Balance::zero);
    }

    @Override
    public List<Balance> findByOwner(String ownerId) {
        return balances.values().stream()
            .filter(balance -> balance.getOwnerId().equals(ownerId))
            .sorted(Comparator.comparing(balance -> balance.getCurrency().name()))
            .toList();
    }

    @Override
    public <T> T withExclusiveHold(Set<BalanceKey> keys, Function<BalanceHold, T> work) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("At least one balance key is required");
        }
        TreeSet<BalanceKey> ordered = new TreeSet<>(keys);
        Deque<ReentrantLock> acquired = new ArrayDeque<>();
        try {
            for (BalanceKey key : ordered) {
                ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
                if (!lock.tryLock(holdTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new HoldTimeoutException(ordered, holdTimeout, null);
                }
                acquired.push(lock);
            }
            log.debug("Acquired hold on {}", ordered);

            Map<BalanceKey, Balance> held = new LinkedHashMap<>();
            for (BalanceKey key : ordered) {
                held.put(key, balances.computeIfAbsent(key, Balance::zero));
            }

            StagedBalanceHold hold = new StagedBalanceHold(held);
            T result = work.apply(hold);
            commit(hold);
            return result;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HoldTimeoutException(ordered, holdTimeout, e);
        } finally {
            while (!acquired.isEmpty()) {
                acquired.pop().unlock();
            }
        }
    }

    @Override
    public LedgerEntry append(LedgerEntry entry) {
        if (!entry.isTerminal()) {
            throw new IllegalArgumentException("Only terminal entries can be appended, got " + entry.getStatus());
        }
        entries.computeIfAbsent(entry.getOwnerId(), owner -> new ConcurrentLinkedDeque<>()).addFirst(entry);
        return entry;
    }

    @Override
    public List<LedgerEntry> findEntries(String ownerId) {
        Deque<LedgerEntry> owned = entries.get(ownerId);
        return owned == null ? List.of() : new ArrayList<>(owned);
    }

    private void commit(StagedBalanceHold hold) {
        // Each put replaces one immutable value; readers see either the old or the new balance.
        hold.dirtyBalances().forEach(balances::put);
        hold.recordedEntries().forEach(this::append);
    }
}
