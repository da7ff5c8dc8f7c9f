package com.flagship.fx_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fx_ledger.fx.Conversion;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ConversionResponse {

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("rate")
    BigDecimal rate;

    @JsonProperty("converted_amount")
    BigDecimal convertedAmount;

    public static ConversionResponse from(Conversion conversion) {
        return ConversionResponse.builder()
            .from(conversion.getFrom().name())
            .to(conversion.getTo().name())
            .amount(conversion.getRequestedAmount())
            .rate(conversion.getRate())
            .convertedAmount(conversion.getConvertedAmount())
            .build();
    }
}
