package com.flagship.fx_ledger.fx;

import com.flagship.fx_ledger.currency.CurrencyCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

class HttpLiveRateProviderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private FxProperties properties;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new FxProperties();
        properties.getProvider().setBaseUrl("http://live.test/api");
        properties.getProvider().setApiKey("key");
    }

    @Test
    @DisplayName("Supported currencies of the rates object become the table")
    void testFetchRates() {
        server.expect(requestTo("http://live.test/api/latest/EUR"))
            .andExpect(header("X-Api-Key", "key"))
            .andRespond(withSuccess("""
                {"base": "EUR", "rates": {"USD": 1.09, "GBP": 0.86, "SEK": 11.2}}
                """, MediaType.APPLICATION_JSON));

        ExchangeRateTable table = new HttpLiveRateProvider(restTemplate, properties, clock).fetchRates(CurrencyCode.EUR);

        assertEquals(CurrencyCode.EUR, table.getBase());
        assertEquals(2, table.getRates().size());
        assertEquals(new BigDecimal("1.09"), table.rateFor(CurrencyCode.USD).orElseThrow());
        assertTrue(table.rateFor(CurrencyCode.NGN).isEmpty());
        assertEquals(NOW, table.getFetchedAt());
        server.verify();
    }

    @Test
    @DisplayName("Server errors are retryable")
    void testServerErrorRetryable() {
        server.expect(requestTo("http://live.test/api/latest/USD")).andRespond(withServerError());

        RateFetchException e = assertThrows(RateFetchException.class,
            () -> new HttpLiveRateProvider(restTemplate, properties, clock).fetchRates(CurrencyCode.USD));

        assertTrue(e.isRetryable());
    }

    @Test
    @DisplayName("Rejected credentials are not retryable")
    void testUnauthorizedNotRetryable() {
        server.expect(requestTo("http://live.test/api/latest/USD")).andRespond(withUnauthorizedRequest());

        RateFetchException e = assertThrows(RateFetchException.class,
            () -> new HttpLiveRateProvider(restTemplate, properties, clock).fetchRates(CurrencyCode.USD));

        assertFalse(e.isRetryable());
    }

    @Test
    @DisplayName("Body without rates is retryable garbage")
    void testInvalidBody() {
        server.expect(requestTo("http://live.test/api/latest/USD"))
            .andRespond(withSuccess("{\"result\": \"error\"}", MediaType.APPLICATION_JSON));

        RateFetchException e = assertThrows(RateFetchException.class,
            () -> new HttpLiveRateProvider(restTemplate, properties, clock).fetchRates(CurrencyCode.USD));

        assertTrue(e.isRetryable());
    }

    @Test
    @DisplayName("Missing configuration fails without a request")
    void testNotConfigured() {
        properties.getProvider().setApiKey("");

        RateFetchException e = assertThrows(RateFetchException.class,
            () -> new HttpLiveRateProvider(restTemplate, properties, clock).fetchRates(CurrencyCode.USD));

        assertFalse(e.isRetryable());
        server.verify();
    }
}
