package com.flagship.fx_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fx_ledger.ledger.EntryKind;
import com.flagship.fx_ledger.ledger.EntryStatus;
import com.flagship.fx_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Ledger entry as returned by the wallet endpoints.
 */
@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("owner_id")
    String ownerId;

    @JsonProperty("kind")
    EntryKind kind;

    @JsonProperty("status")
    EntryStatus status;

    @JsonProperty("source_currency")
    String sourceCurrency;

    @JsonProperty("target_currency")
    String targetCurrency;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("rate")
    BigDecimal rate;

    @JsonProperty("converted_amount")
    BigDecimal convertedAmount;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("description")
    String description;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .ownerId(entry.getOwnerId())
            .kind(entry.getKind())
            .status(entry.getStatus())
            .sourceCurrency(entry.getSourceCurrency().name())
            .targetCurrency(entry.getTargetCurrency().name())
            .amount(entry.getSourceAmount())
            .rate(entry.getRate())
            .convertedAmount(entry.getTargetAmount())
            .reference(entry.getReference())
            .description(entry.getDescription())
            .failureReason(entry.getFailureReason())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
