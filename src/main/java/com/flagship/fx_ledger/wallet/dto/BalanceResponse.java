package com.flagship.fx_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fx_ledger.balance.Balance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("currency")
    String currency;

    @JsonProperty("total")
    BigDecimal total;

    @JsonProperty("locked")
    BigDecimal locked;

    @JsonProperty("available")
    BigDecimal available;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static BalanceResponse from(Balance balance) {
        return BalanceResponse.builder()
            .currency(balance.getCurrency().name())
            .total(balance.getTotal())
            .locked(balance.getLocked())
            .available(balance.getAvailable())
            .updatedAt(balance.getUpdatedAt())
            .build();
    }
}
