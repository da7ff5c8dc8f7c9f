package com.flagship.fx_ledger.balance;

import com.flagship.fx_ledger.config.LedgerProperties;
import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.ledger.LedgerEntry;
import com.flagship.fx_ledger.ledger.LedgerEntryEntity;
import com.flagship.fx_ledger.ledger.LedgerEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Balance store backed by PostgreSQL row locks.
 *
 * Each hold runs in its own transaction (REQUIRES_NEW) so that the commit, and
 * with it durability, happens before the row locks are released:
 * 1. Missing rows are created with INSERT ... ON CONFLICT DO NOTHING
 * 2. Rows are locked with SELECT ... FOR UPDATE in canonical key order
 * 3. The work function mutates a staged copy
 * 4. Staged balances and entries are written and the transaction commits
 *
 * Any exception from the work function rolls the transaction back, so no
 * partial multi-balance mutation is ever persisted.
 */
@Component
@ConditionalOnProperty(name = "ledger.balance-store", havingValue = "jpa", matchIfMissing = true)
@Slf4j
public class JpaBalanceStore implements BalanceStore {

    private final BalanceRepository balanceRepository;
    private final LedgerEntryRepository entryRepository;
    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;
    private final Duration holdTimeout;

    public JpaBalanceStore(BalanceRepository balanceRepository,
                           LedgerEntryRepository entryRepository,
                           PlatformTransactionManager transactionManager,
                           LedgerProperties properties) {
        this.balanceRepository = balanceRepository;
        this.entryRepository = entryRepository;
        this.holdTimeout = properties.getHoldTimeout();

        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
    }

    @Override
    public Balance getOrCreate(String ownerId, CurrencyCode currency) {
        BalanceKey key = BalanceKey.of(ownerId, currency);
        return translate(Set.of(key), () -> writeTransaction.execute(status -> {
            balanceRepository.insertIfAbsent(key.getOwnerId(), key.getCurrency().name());
            return balanceRepository.findByOwnerIdAndCurrency(key.getOwnerId(), key.getCurrency())
                .map(BalanceEntity::toDomain)
                .orElseThrow(() -> new BalanceStoreException("Balance " + key + " vanished after insert", false, null));
        }));
    }

    @Override
    public List<Balance> findByOwner(String ownerId) {
        return translate(Set.of(), () -> readTransaction.execute(status ->
            balanceRepository.findByOwnerIdOrderByCurrencyAsc(ownerId).stream()
                .map(BalanceEntity::toDomain)
                .toList()));
    }

    @Override
    public <T> T withExclusiveHold(Set<BalanceKey> keys, Function<BalanceHold, T> work) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("At least one balance key is required");
        }
        TreeSet<BalanceKey> ordered = new TreeSet<>(keys);

        return translate(ordered, () -> writeTransaction.execute(status -> {
            // Bounds every row lock wait below; scoped to this transaction
            balanceRepository.setLocalLockTimeout(holdTimeout.toMillis() + "ms");

            // Make sure every row exists before locking
            for (BalanceKey key : ordered) {
                balanceRepository.insertIfAbsent(key.getOwnerId(), key.getCurrency().name());
            }

            // Lock rows in canonical order
            Map<BalanceKey, BalanceEntity> rows = new LinkedHashMap<>();
            Map<BalanceKey, Balance> held = new LinkedHashMap<>();
            for (BalanceKey key : ordered) {
                BalanceEntity row = balanceRepository.findForUpdate(key.getOwnerId(), key.getCurrency())
                    .orElseThrow(() -> new BalanceStoreException("Balance row missing for " + key, false, null));
                rows.put(key, row);
                held.put(key, row.toDomain());
            }
            log.debug("Acquired row locks on {}", ordered);

            // Run the work against staged copies
            // A throw here rolls back the transaction before anything is written
            StagedBalanceHold hold = new StagedBalanceHold(held);
            T result = work.apply(hold);

            // Write changed balances and recorded entries together
            hold.dirtyBalances().forEach((key, balance) -> rows.get(key).applyFrom(balance));
            balanceRepository.saveAll(rows.values());
            hold.recordedEntries().forEach(entry -> entryRepository.save(LedgerEntryEntity.fromDomain(entry)));
            // Surface constraint violations here, while the locks are still held
            balanceRepository.flush();
            return result;
        }));
    }

    @Override
    public LedgerEntry append(LedgerEntry entry) {
        return translate(Set.of(), () -> writeTransaction.execute(status ->
            entryRepository.save(LedgerEntryEntity.fromDomain(entry)).toDomain()));
    }

    @Override
    public List<LedgerEntry> findEntries(String ownerId) {
        return translate(Set.of(), () -> readTransaction.execute(status ->
            entryRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
                .map(LedgerEntryEntity::toDomain)
                .toList()));
    }

    /**
     * Maps Spring's storage exceptions onto the store's own failure types.
     * Exceptions raised by the work function itself pass through untouched.
     */
    private <T> T translate(Set<BalanceKey> keys, StoreCall<T> call) {
        try {
            return call.run();
        } catch (PessimisticLockingFailureException e) {
            log.warn("Lock wait exceeded for {}: {}", keys, e.getMessage());
            throw new HoldTimeoutException(keys, holdTimeout, e);
        } catch (DataAccessException e) {
            boolean retryable = isRetryable(e);
            log.error("Storage failure for {} (retryable={}): {}", keys, retryable, e.getMessage());
            throw new BalanceStoreException("Storage failure", retryable, e);
        } catch (TransactionException e) {
            log.error("Transaction failure for {}: {}", keys, e.getMessage());
            throw new BalanceStoreException("Transaction could not be completed", true, e);
        }
    }

    private static boolean isRetryable(DataAccessException e) {
        return e instanceof TransientDataAccessException
            || e instanceof RecoverableDataAccessException
            || e instanceof DataAccessResourceFailureException;
    }

    @FunctionalInterface
    private interface StoreCall<T> {
        T run();
    }
}
