package com.flagship.fx_ledger.fx;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.fx_ledger.currency.CurrencyCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.Iterator;
import java.util.Map;

/**
 * Fetches {@code GET {baseUrl}/latest/{base}} with an {@code X-Api-Key} header
 * and reads the {@code rates} object of the response.
 */
@Component
@Slf4j
public class HttpLiveRateProvider implements LiveRateProvider {

    private final RestTemplate restTemplate;
    private final FxProperties.Provider settings;
    private final Clock clock;

    public HttpLiveRateProvider(@Qualifier("fxRestTemplate") RestTemplate restTemplate,
                                FxProperties properties,
                                Clock clock) {
        this.restTemplate = restTemplate;
        this.settings = properties.getProvider();
        this.clock = clock;
        if (!settings.isConfigured()) {
            log.error("Live rate provider is not configured (fx.provider.base-url / fx.provider.api-key); "
                + "live rate requests will fail");
        }
    }

    @Override
    public ExchangeRateTable fetchRates(CurrencyCode base) {
        if (!settings.isConfigured()) {
            throw new RateFetchException("Live rate provider is not configured", false);
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
            .pathSegment("latest", base.name())
            .build()
            .toUri();
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Api-Key", settings.getApiKey());

        JsonNode body;
        try {
            body = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class).getBody();
        } catch (HttpClientErrorException.Unauthorized | HttpClientErrorException.Forbidden e) {
            throw new RateFetchException("Live rate provider rejected credentials: " + e.getStatusCode(), false, e);
        } catch (RestClientException e) {
            throw new RateFetchException("Live rate fetch for " + base + " failed: " + e.getMessage(), true, e);
        }

        if (body == null || !body.path("rates").isObject()) {
            throw new RateFetchException("Invalid response from live rate provider for " + base, true);
        }

        ExchangeRateTable.ExchangeRateTableBuilder table = ExchangeRateTable.builder()
            .base(base)
            .fetchedAt(clock.instant());
        Iterator<Map.Entry<String, JsonNode>> fields = body.path("rates").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNumber()) {
                CurrencyCode.find(field.getKey())
                    .ifPresent(currency -> table.rate(currency, field.getValue().decimalValue()));
            }
        }
        return table.build();
    }
}
