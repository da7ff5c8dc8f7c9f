package com.flagship.fx_ledger.ledger;

import com.flagship.fx_ledger.balance.Balance;
import com.flagship.fx_ledger.currency.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one money movement.
 *
 * An entry starts as PENDING when the ledger operation begins and is written
 * exactly once, either COMPLETED (atomically with the balance mutation) or
 * FAILED (after the mutation was rolled back). Transitions return new
 * instances; terminal entries cannot transition again.
 */
@Value
public class LedgerEntry {
    UUID id;
    String ownerId;
    EntryKind kind;
    EntryStatus status;
    CurrencyCode sourceCurrency;
    CurrencyCode targetCurrency;
    BigDecimal sourceAmount;
    BigDecimal rate;
    BigDecimal targetAmount;
    String reference;
    String description;
    String failureReason;
    Instant createdAt;

    /**
     * Creates a PENDING entry for an operation that is about to run.
     */
    public static LedgerEntry pending(String ownerId, EntryKind kind,
                                      CurrencyCode sourceCurrency, CurrencyCode targetCurrency,
                                      BigDecimal sourceAmount, String reference, String description) {
        return new LedgerEntry(
            UUID.randomUUID(),
            ownerId,
            kind,
            EntryStatus.PENDING,
            sourceCurrency,
            targetCurrency,
            Balance.scale(sourceAmount),
            null,
            null,
            reference,
            description,
            null,
            Instant.now()
        );
    }

    /**
     * Transitions to COMPLETED, recording the applied rate and converted amount.
     *
     * @throws IllegalStateException if the entry is not PENDING
     */
    public LedgerEntry complete(BigDecimal appliedRate, BigDecimal convertedAmount) {
        return complete(appliedRate, convertedAmount, this.description);
    }

    /**
     * Transitions to COMPLETED with a description that depends on the applied
     * rate, as for trades.
     *
     * @throws IllegalStateException if the entry is not PENDING
     */
    public LedgerEntry complete(BigDecimal appliedRate, BigDecimal convertedAmount, String finalDescription) {
        requirePending(EntryStatus.COMPLETED);
        return new LedgerEntry(
            this.id,
            this.ownerId,
            this.kind,
            EntryStatus.COMPLETED,
            this.sourceCurrency,
            this.targetCurrency,
            this.sourceAmount,
            appliedRate,
            Balance.scale(convertedAmount),
            this.reference,
            finalDescription,
            null,
            this.createdAt
        );
    }

    /**
     * Transitions to FAILED with the reason the operation was aborted.
     *
     * @throws IllegalStateException if the entry is not PENDING
     */
    public LedgerEntry fail(String reason) {
        requirePending(EntryStatus.FAILED);
        return new LedgerEntry(
            this.id,
            this.ownerId,
            this.kind,
            EntryStatus.FAILED,
            this.sourceCurrency,
            this.targetCurrency,
            this.sourceAmount,
            this.rate,
            this.targetAmount,
            this.reference,
            this.description,
            reason,
            this.createdAt
        );
    }

    /**
     * Same-currency movements (funding, transfer) apply a unit rate.
     */
    public LedgerEntry completeAtPar() {
        return complete(BigDecimal.ONE, sourceAmount);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private void requirePending(EntryStatus target) {
        if (this.status != EntryStatus.PENDING) {
            throw new IllegalStateException(String.format(
                "Cannot move ledger entry %s from %s to %s. Only PENDING entries can transition.",
                id, status, target));
        }
    }
}
