package com.flagship.fx_ledger.ledger;

import com.flagship.fx_ledger.balance.Balance;
import com.flagship.fx_ledger.balance.BalanceHold;
import com.flagship.fx_ledger.balance.BalanceKey;
import com.flagship.fx_ledger.balance.BalanceStore;
import com.flagship.fx_ledger.balance.BalanceStoreException;
import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.fx.Conversion;
import com.flagship.fx_ledger.fx.RateQuote;
import com.flagship.fx_ledger.fx.RateResolver;
import com.flagship.fx_ledger.fx.RateSanityPolicy;
import com.flagship.fx_ledger.fx.RateUnavailableException;
import com.flagship.fx_ledger.ledger.notification.LedgerNotification;
import com.flagship.fx_ledger.ledger.notification.LedgerNotificationSink;
import com.flagship.fx_ledger.observability.CorrelationContext;
import com.flagship.fx_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Ledger engine: funding, transfers and trades as atomic units against the
 * balance store.
 *
 * Every operation follows the same sequence:
 * 1. Check owner eligibility, then validate inputs (nothing held yet)
 * 2. Acquire exclusive holds on the affected balances in canonical key order
 * 3. Check funds, apply the deltas and record a COMPLETED entry
 * 4. Commit, release the holds and emit a notification
 *
 * Any failure after step 2 rolls back every staged mutation, records a FAILED
 * entry in a separate unit of work and emits a FAILED notification. Failures
 * in step 1 record nothing. Notification delivery never affects the outcome.
 */
@Service
@Slf4j
public class LedgerService {

    private final BalanceStore store;
    private final RateResolver rateResolver;
    private final RateSanityPolicy sanityPolicy;
    private final OwnerEligibilityCheck eligibility;
    private final LedgerNotificationSink notifications;
    private final LedgerMetrics metrics;

    public LedgerService(BalanceStore store,
                         RateResolver rateResolver,
                         RateSanityPolicy sanityPolicy,
                         OwnerEligibilityCheck eligibility,
                         LedgerNotificationSink notifications,
                         LedgerMetrics metrics) {
        this.store = store;
        this.rateResolver = rateResolver;
        this.sanityPolicy = sanityPolicy;
        this.eligibility = eligibility;
        this.notifications = notifications;
        this.metrics = metrics;
    }

    /**
     * Adds {@code amount} to the owner's balance in {@code currency}.
     *
     * @return the COMPLETED FUNDING entry, rate 1
     * @throws LedgerException INVALID_AMOUNT, OWNER_NOT_ELIGIBLE, STORAGE_UNAVAILABLE or INTERNAL
     */
    public LedgerEntry fund(String ownerId, BigDecimal amount, CurrencyCode currency, String reference) {
        return run(EntryKind.FUNDING, ownerId, () -> {
            requireEligible(ownerId);
            requirePositive(amount);
            requireCurrency(currency);

            LedgerEntry pending = LedgerEntry.pending(ownerId, EntryKind.FUNDING, currency, currency, amount,
                reference, String.format("Wallet funded with %s %s", amount.toPlainString(), currency));
            BalanceKey key = BalanceKey.of(ownerId, currency);

            return execute(pending, Set.of(key), hold -> {
                requireCapacity(hold, key, pending.getSourceAmount());
                hold.credit(key, pending.getSourceAmount());
                return pending.completeAtPar();
            });
        });
    }

    /**
     * Moves {@code amount} of one currency from one owner to another.
     * Only the sender has to be eligible.
     *
     * @return the COMPLETED TRANSFER entry, attributed to the sender
     * @throws LedgerException SAME_OWNER, INVALID_RECIPIENT, INVALID_AMOUNT, OWNER_NOT_ELIGIBLE, INSUFFICIENT_FUNDS,
     *                         STORAGE_UNAVAILABLE or INTERNAL
     */
    public LedgerEntry transfer(String fromOwnerId, String toOwnerId, BigDecimal amount,
                                CurrencyCode currency, String description) {
        return run(EntryKind.TRANSFER, fromOwnerId, () -> {
            requireEligible(fromOwnerId);
            if (toOwnerId == null || toOwnerId.isBlank()) {
                throw new LedgerException(LedgerErrorCode.INVALID_RECIPIENT, "Recipient is required");
            }
            if (fromOwnerId.equals(toOwnerId)) {
                throw new LedgerException(LedgerErrorCode.SAME_OWNER, "Cannot transfer funds to the same owner");
            }
            if (!eligibility.isRegistered(toOwnerId)) {
                throw new LedgerException(LedgerErrorCode.INVALID_RECIPIENT,
                    "Recipient " + toOwnerId + " is not registered");
            }
            requirePositive(amount);
            requireCurrency(currency);

            String text = description == null || description.isBlank()
                ? "Transfer to user " + toOwnerId
                : description;
            LedgerEntry pending = LedgerEntry.pending(fromOwnerId, EntryKind.TRANSFER, currency, currency,
                amount, toOwnerId, text);
            BalanceKey sender = BalanceKey.of(fromOwnerId, currency);
            BalanceKey receiver = BalanceKey.of(toOwnerId, currency);

            return execute(pending, Set.of(sender, receiver), hold -> {
                requireFunds(hold, sender, pending.getSourceAmount());
                requireCapacity(hold, receiver, pending.getSourceAmount());
                hold.debit(sender, pending.getSourceAmount());
                hold.credit(receiver, pending.getSourceAmount());
                return pending.completeAtPar();
            });
        });
    }

    /**
     * Converts {@code amount} of one currency into another for the same owner
     * at the live rate resolved while the balances are held.
     *
     * @return the COMPLETED TRADE entry with the applied rate and converted amount
     * @throws LedgerException SAME_CURRENCY, INVALID_AMOUNT, OWNER_NOT_ELIGIBLE, RATE_UNAVAILABLE,
     *                         INSUFFICIENT_FUNDS, STORAGE_UNAVAILABLE or INTERNAL
     */
    public LedgerEntry trade(String ownerId, CurrencyCode fromCurrency, CurrencyCode toCurrency, BigDecimal amount) {
        return run(EntryKind.TRADE, ownerId, () -> {
            requireEligible(ownerId);
            requireCurrency(fromCurrency);
            requireCurrency(toCurrency);
            if (fromCurrency == toCurrency) {
                throw new LedgerException(LedgerErrorCode.SAME_CURRENCY, "Cannot trade the same currency");
            }
            requirePositive(amount);

            LedgerEntry pending = LedgerEntry.pending(ownerId, EntryKind.TRADE, fromCurrency, toCurrency,
                amount, null, null);
            BalanceKey source = BalanceKey.of(ownerId, fromCurrency);
            BalanceKey target = BalanceKey.of(ownerId, toCurrency);

            return execute(pending, Set.of(source, target), hold -> {
                RateQuote quote = rateResolver.resolveRate(fromCurrency, toCurrency);
                sanityPolicy.check(quote);
                requireFunds(hold, source, pending.getSourceAmount());

                Conversion conversion = Conversion.of(fromCurrency, toCurrency,
                    pending.getSourceAmount(), quote.getRate());
                if (conversion.getConvertedAmount().signum() <= 0) {
                    throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT,
                        "Amount " + amount.toPlainString() + " " + fromCurrency + " converts to zero " + toCurrency);
                }
                requireCapacity(hold, target, conversion.getConvertedAmount());
                hold.debit(source, conversion.getRequestedAmount());
                hold.credit(target, conversion.getConvertedAmount());

                return pending.complete(conversion.getRate(), conversion.getConvertedAmount(),
                    String.format("Trade %s %s for %s %s at rate %s",
                        amount.toPlainString(), fromCurrency,
                        conversion.getConvertedAmount().toPlainString(), toCurrency,
                        conversion.getRate().toPlainString()));
            });
        });
    }

    /**
     * Balances of one owner, ordered by currency. Never creates balances.
     *
     * @throws LedgerException OWNER_NOT_ELIGIBLE or STORAGE_UNAVAILABLE
     */
    public List<Balance> getBalances(String ownerId) {
        return withStorage(() -> {
            requireEligible(ownerId);
            return store.findByOwner(ownerId);
        });
    }

    /**
     * Ledger entries of one owner, newest first.
     *
     * @throws LedgerException OWNER_NOT_ELIGIBLE or STORAGE_UNAVAILABLE
     */
    public List<LedgerEntry> getLedgerEntries(String ownerId) {
        return withStorage(() -> {
            requireEligible(ownerId);
            return store.findEntries(ownerId);
        });
    }

    // ==================== Operation plumbing ====================

    /**
     * Wraps an operation with MDC context, metrics and error translation.
     */
    private LedgerEntry run(EntryKind kind, String ownerId, Supplier<LedgerEntry> operation) {
        long start = System.nanoTime();
        MDC.put(CorrelationContext.OWNER_ID_MDC_KEY, String.valueOf(ownerId));
        try {
            LedgerEntry entry = operation.get();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordOperation(kind.name(), "completed", elapsed);
            log.info("{} completed: entryId={}, amount={} {}, duration={}ms",
                    kind, entry.getId(), entry.getSourceAmount(), entry.getSourceCurrency(), elapsed.toMillis());
            return entry;

        } catch (RuntimeException e) {
            LedgerException failure = translate(e);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordOperation(kind.name(), failure.getCode().name(), elapsed);
            if (failure.getCode().getCategory() == LedgerErrorCode.Category.DEPENDENCY
                    || failure.getCode().getCategory() == LedgerErrorCode.Category.FATAL) {
                log.error("{} aborted: code={}, error={}", kind, failure.getCode(), failure.getMessage(), failure.getCause());
            } else {
                log.warn("{} rejected: code={}, error={}", kind, failure.getCode(), failure.getMessage());
            }
            throw failure;

        } finally {
            MDC.remove(CorrelationContext.OWNER_ID_MDC_KEY);
        }
    }

    /**
     * Runs the held section of an operation and tracks its state.
     *
     * The mutation stages balance changes on the hold and returns the
     * COMPLETED entry; the entry is recorded in the same unit of work.
     */
    private LedgerEntry execute(LedgerEntry pending, Set<BalanceKey> keys, Function<BalanceHold, LedgerEntry> mutation) {
        LedgerOperation operation = new LedgerOperation(pending.getId(), pending.getKind());
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, pending.getId().toString());
        try {
            LedgerEntry completed;
            try {
                // Phase 1: hold the balances, mutate and record the entry
                // The store commits the staged balances and the entry together
                // when the callback returns, and discards both if it throws.
                completed = store.withExclusiveHold(keys, hold -> {
                    operation.held();
                    LedgerEntry entry = mutation.apply(hold);
                    operation.mutated();
                    return hold.record(entry);
                });
                operation.persisted();
            } catch (RuntimeException e) {
                // Rolled back: neither balances nor the entry were written
                operation.aborted();
                LedgerException failure = translate(e);
                // Rejections before the hold (timeouts included) leave no trace
                if (operation.reachedHold()) {
                    recordFailure(pending, failure);
                }
                throw failure;
            }

            // Phase 2: notify, fire-and-forget
            notifyQuietly(completed);
            return completed;

        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    /**
     * Writes the FAILED entry after the rollback. A failure here is logged
     * and does not replace the error that aborted the operation.
     */
    private void recordFailure(LedgerEntry pending, LedgerException failure) {
        LedgerEntry failed = pending.fail(failure.getCode() + ": " + failure.getMessage());
        try {
            // Own unit of work: the aborted hold has already been rolled back
            store.append(failed);
        } catch (RuntimeException e) {
            log.error("Failed to record FAILED entry {}: {}", failed.getId(), e.getMessage());
            return;
        }
        notifyQuietly(failed);
    }

    private void notifyQuietly(LedgerEntry entry) {
        try {
            notifications.publish(LedgerNotification.from(entry, CorrelationContext.getCorrelationId()));
        } catch (RuntimeException e) {
            log.error("Notification for entry {} could not be published: {}", entry.getId(), e.getMessage());
            metrics.recordNotificationFailed();
        }
    }

    private <T> T withStorage(Supplier<T> read) {
        try {
            return read.get();
        } catch (RuntimeException e) {
            throw translate(e);
        }
    }

    /**
     * Maps any failure onto the ledger error taxonomy.
     */
    static LedgerException translate(RuntimeException e) {
        if (e instanceof LedgerException ledger) {
            return ledger;
        }
        if (e instanceof RateUnavailableException) {
            return new LedgerException(LedgerErrorCode.RATE_UNAVAILABLE, e.getMessage(), e);
        }
        if (e instanceof BalanceStoreException store) {
            return store.isRetryable()
                ? new LedgerException(LedgerErrorCode.STORAGE_UNAVAILABLE, e.getMessage(), e)
                : new LedgerException(LedgerErrorCode.INTERNAL, "Storage failure: " + e.getMessage(), e);
        }
        if (e instanceof DataAccessException) {
            return new LedgerException(LedgerErrorCode.STORAGE_UNAVAILABLE, "Storage unavailable", e);
        }
        return new LedgerException(LedgerErrorCode.INTERNAL, "Unexpected ledger failure: " + e.getMessage(), e);
    }

    // ==================== Checks ====================

    private void requireEligible(String ownerId) {
        if (ownerId == null || ownerId.isBlank() || !eligibility.isEligible(ownerId)) {
            throw LedgerException.notEligible(ownerId);
        }
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw LedgerException.invalidAmount(amount);
        }
        if (Balance.scale(amount).signum() == 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT,
                "Amount " + amount.toPlainString() + " is below the smallest unit of " + Balance.SCALE + " decimals");
        }
        if (Balance.scale(amount).compareTo(Balance.MAX_AMOUNT) > 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT,
                "Amount " + amount.toPlainString() + " exceeds the maximum of " + Balance.MAX_AMOUNT.toPlainString());
        }
    }

    private static void requireCurrency(CurrencyCode currency) {
        if (currency == null) {
            throw new LedgerException(LedgerErrorCode.UNSUPPORTED_CURRENCY, "Currency is required");
        }
    }

    private static void requireCapacity(BalanceHold hold, BalanceKey key, BigDecimal amount) {
        Balance balance = hold.balance(key);
        if (!balance.canAccept(amount)) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, String.format(
                "Crediting %s to %s would exceed the maximum balance of %s",
                amount.toPlainString(), key, Balance.MAX_AMOUNT.toPlainString()));
        }
    }

    private static void requireFunds(BalanceHold hold, BalanceKey key, BigDecimal amount) {
        Balance balance = hold.balance(key);
        if (!balance.canCover(amount)) {
            throw LedgerException.insufficientFunds(key, balance.getAvailable(), amount);
        }
    }
}
