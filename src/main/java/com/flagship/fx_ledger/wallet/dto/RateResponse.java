package com.flagship.fx_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fx_ledger.fx.RateQuote;
import com.flagship.fx_ledger.fx.RateSourceKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class RateResponse {

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    @JsonProperty("rate")
    BigDecimal rate;

    @JsonProperty("source")
    RateSourceKind source;

    @JsonProperty("as_of")
    Instant asOf;

    public static RateResponse from(RateQuote quote) {
        return RateResponse.builder()
            .from(quote.getFrom().name())
            .to(quote.getTo().name())
            .rate(quote.getRate())
            .source(quote.getSource())
            .asOf(quote.getAsOf())
            .build();
    }
}
