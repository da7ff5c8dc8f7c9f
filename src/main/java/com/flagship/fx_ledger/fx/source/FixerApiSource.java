package com.flagship.fx_ledger.fx.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.fx.FxProperties;
import com.flagship.fx_ledger.fx.RatePoint;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixer API. The free tier only quotes against EUR, so every EUR → X rate is
 * returned together with its X → EUR inverse.
 */
@Component
public class FixerApiSource extends AbstractHttpRateSource {

    private final CurrencyCode base;

    public FixerApiSource(@Qualifier("fxRestTemplate") RestTemplate restTemplate, FxProperties properties) {
        super(restTemplate, properties.getSources().getFixer());
        this.base = CurrencyCode.fromCode(settings.getBase());
    }

    @Override
    public RateSourceType type() {
        return RateSourceType.FIXER;
    }

    @Override
    protected URI latestRatesUri() {
        return UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
            .pathSegment("latest")
            .queryParam("access_key", settings.getApiKey())
            .queryParam("base", base.name())
            .build()
            .toUri();
    }

    @Override
    protected List<RatePoint> toRatePoints(JsonNode body) {
        // Fixer reports errors with HTTP 200 and success=false
        if (body.has("success") && !body.path("success").asBoolean()) {
            throw new RateSourceException("Fixer API rejected the request: " + body.path("error").path("info").asText("unknown error"));
        }
        List<RatePoint> points = new ArrayList<>();
        for (RatePoint point : parseRates(body.path("rates"), base, timestampOf(body))) {
            points.add(point);
            if (point.getRate().signum() > 0) {
                points.add(point.inverse());
            }
        }
        return points;
    }
}
