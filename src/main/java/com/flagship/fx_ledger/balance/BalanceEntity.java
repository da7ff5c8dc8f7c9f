package com.flagship.fx_ledger.balance;

import com.flagship.fx_ledger.currency.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for one (owner, currency) balance row.
 *
 * No setters: the only way to change amounts is {@link #applyFrom(Balance)},
 * called by the store with a value that already passed the domain invariants.
 * The database repeats those invariants as CHECK constraints.
 */
@Entity
@Table(
    name = "wallet_balances",
    uniqueConstraints = @UniqueConstraint(name = "uq_wallet_balances_owner_currency",
        columnNames = {"owner_id", "currency"}),
    indexes = @Index(name = "idx_wallet_balances_owner", columnList = "owner_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BalanceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(nullable = false, precision = 20, scale = 8)
    private BigDecimal total;

    @Column(nullable = false, precision = 20, scale = 8)
    private BigDecimal locked;

    @Column(nullable = false, precision = 20, scale = 8)
    private BigDecimal available;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public BalanceKey key() {
        return BalanceKey.of(ownerId, currency);
    }

    public Balance toDomain() {
        return new Balance(key(), total, locked, available, updatedAt);
    }

    /**
     * Copies amounts from a validated domain balance with the same key.
     */
    void applyFrom(Balance balance) {
        if (!balance.getKey().equals(key())) {
            throw new IllegalArgumentException(
                "Cannot apply balance " + balance.getKey() + " to row " + key());
        }
        this.total = balance.getTotal();
        this.locked = balance.getLocked();
        this.available = balance.getAvailable();
    }
}
