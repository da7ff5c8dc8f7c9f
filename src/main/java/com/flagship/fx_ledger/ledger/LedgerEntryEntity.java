package com.flagship.fx_ledger.ledger;

import com.flagship.fx_ledger.currency.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for a ledger entry.
 *
 * Append-only: every column is {@code updatable = false} and the entity is
 * {@link Immutable}. A database trigger rejects UPDATE and DELETE as well.
 */
@Entity
@Immutable
@Table(
    name = "ledger_entries",
    indexes = @Index(name = "idx_ledger_entries_owner_created", columnList = "owner_id, created_at")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private EntryKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private EntryStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_currency", nullable = false, updatable = false, length = 3)
    private CurrencyCode sourceCurrency;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_currency", nullable = false, updatable = false, length = 3)
    private CurrencyCode targetCurrency;

    @Column(name = "source_amount", nullable = false, updatable = false, precision = 20, scale = 8)
    private BigDecimal sourceAmount;

    // Unconstrained NUMERIC: live rates are stored at full precision
    @Column(updatable = false)
    private BigDecimal rate;

    @Column(name = "target_amount", updatable = false, precision = 20, scale = 8)
    private BigDecimal targetAmount;

    @Column(updatable = false)
    private String reference;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String description;

    @Column(name = "failure_reason", updatable = false, columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Only terminal entries are persisted.
     */
    public static LedgerEntryEntity fromDomain(LedgerEntry entry) {
        if (!entry.isTerminal()) {
            throw new IllegalArgumentException(
                "Ledger entry " + entry.getId() + " is " + entry.getStatus() + " and cannot be persisted");
        }
        return new LedgerEntryEntity(
            entry.getId(),
            entry.getOwnerId(),
            entry.getKind(),
            entry.getStatus(),
            entry.getSourceCurrency(),
            entry.getTargetCurrency(),
            entry.getSourceAmount(),
            entry.getRate(),
            entry.getTargetAmount(),
            entry.getReference(),
            entry.getDescription(),
            entry.getFailureReason(),
            entry.getCreatedAt()
        );
    }

    public LedgerEntry toDomain() {
        return new LedgerEntry(
            id,
            ownerId,
            kind,
            status,
            sourceCurrency,
            targetCurrency,
            sourceAmount,
            rate,
            targetAmount,
            reference,
            description,
            failureReason,
            createdAt
        );
    }
}
