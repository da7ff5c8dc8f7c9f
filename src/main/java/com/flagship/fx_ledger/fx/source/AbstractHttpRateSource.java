package com.flagship.fx_ledger.fx.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.fx.FxProperties;
import com.flagship.fx_ledger.fx.RatePoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared plumbing for JSON-over-HTTP rate sources: configuration checks, the
 * GET itself and parsing of a {@code {"rates": {"EUR": 0.92, ...}}} object.
 */
@Slf4j
public abstract class AbstractHttpRateSource implements RateSource {

    protected final RestTemplate restTemplate;
    protected final FxProperties.Source settings;

    protected AbstractHttpRateSource(RestTemplate restTemplate, FxProperties.Source settings) {
        this.restTemplate = restTemplate;
        this.settings = settings;
        if (!settings.isConfigured()) {
            log.warn("{} is not configured and will be skipped", type().getDisplayName());
        }
    }

    /**
     * Request for the source's latest rates.
     */
    protected abstract URI latestRatesUri();

    /**
     * Converts a successful response body into rate points.
     */
    protected abstract List<RatePoint> toRatePoints(JsonNode body);

    protected HttpHeaders headers() {
        return new HttpHeaders();
    }

    @Override
    public boolean isAvailable() {
        if (!settings.isConfigured()) {
            return false;
        }
        try {
            fetch();
            return true;
        } catch (RuntimeException e) {
            log.error("{} is not available: {}", type().getDisplayName(), e.getMessage());
            return false;
        }
    }

    @Override
    public List<RatePoint> getRates() {
        if (!settings.isConfigured()) {
            throw new RateSourceException(type().getDisplayName() + " is not configured");
        }
        List<RatePoint> points = toRatePoints(fetch());
        log.debug("{} returned {} rate points", type().getDisplayName(), points.size());
        return points;
    }

    private JsonNode fetch() {
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                latestRatesUri(), HttpMethod.GET, new HttpEntity<>(headers()), JsonNode.class);
            JsonNode body = response.getBody();
            if (body == null || !body.path("rates").isObject()) {
                throw new RateSourceException("Invalid response from " + type().getDisplayName() + ": no rates");
            }
            return body;
        } catch (RestClientException e) {
            throw new RateSourceException(
                "Failed to fetch rates from " + type().getDisplayName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads {@code base → currency} rates for every supported currency in the
     * rates object. Unsupported currencies and non-numeric values are ignored;
     * range validation is left to the fallback refresher.
     */
    protected List<RatePoint> parseRates(JsonNode rates, CurrencyCode base, Instant timestamp) {
        List<RatePoint> points = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = rates.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<CurrencyCode> currency = CurrencyCode.find(field.getKey());
            if (currency.isEmpty() || currency.get() == base || !field.getValue().isNumber()) {
                continue;
            }
            BigDecimal rate = field.getValue().decimalValue();
            points.add(new RatePoint(base, currency.get(), rate, timestamp, type().getDisplayName()));
        }
        return points;
    }

    /**
     * Epoch-second {@code timestamp} field of the body, or now if absent.
     */
    protected static Instant timestampOf(JsonNode body) {
        JsonNode timestamp = body.path("timestamp");
        return timestamp.canConvertToLong() ? Instant.ofEpochSecond(timestamp.asLong()) : Instant.now();
    }
}
