package com.flagship.fx_ledger.fx.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.fx.FxProperties;
import com.flagship.fx_ledger.fx.RatePoint;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * Base-currency rate table from an ExchangeRates-style API:
 * {@code GET {baseUrl}/latest/{base}} with an {@code X-Api-Key} header.
 */
@Component
public class ExchangeRatesApiSource extends AbstractHttpRateSource {

    private final CurrencyCode base;

    public ExchangeRatesApiSource(@Qualifier("fxRestTemplate") RestTemplate restTemplate,
                                  FxProperties properties) {
        super(restTemplate, properties.getSources().getExchangeRatesApi());
        this.base = CurrencyCode.fromCode(settings.getBase());
    }

    @Override
    public RateSourceType type() {
        return RateSourceType.EXCHANGE_RATES_API;
    }

    @Override
    protected URI latestRatesUri() {
        return UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
            .pathSegment("latest", base.name())
            .build()
            .toUri();
    }

    @Override
    protected HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Api-Key", settings.getApiKey());
        return headers;
    }

    @Override
    protected List<RatePoint> toRatePoints(JsonNode body) {
        return parseRates(body.path("rates"), base, timestampOf(body));
    }
}
