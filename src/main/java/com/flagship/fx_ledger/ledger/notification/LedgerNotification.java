package com.flagship.fx_ledger.ledger.notification;

import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.ledger.EntryKind;
import com.flagship.fx_ledger.ledger.EntryStatus;
import com.flagship.fx_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event emitted after a COMPLETED or FAILED ledger entry has been persisted.
 */
@Value
@Builder
@Jacksonized
public class LedgerNotification {
    UUID eventId;
    String ownerId;
    UUID entryId;
    EntryKind kind;
    BigDecimal amount;
    CurrencyCode currency;
    EntryStatus status;
    String correlationId;
    Instant occurredAt;

    public static LedgerNotification from(LedgerEntry entry, String correlationId) {
        return LedgerNotification.builder()
            .eventId(UUID.randomUUID())
            .ownerId(entry.getOwnerId())
            .entryId(entry.getId())
            .kind(entry.getKind())
            .amount(entry.getSourceAmount())
            .currency(entry.getSourceCurrency())
            .status(entry.getStatus())
            .correlationId(correlationId)
            .occurredAt(Instant.now())
            .build();
    }
}
