package com.flagship.fx_ledger.wallet;

import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.fx.Conversion;
import com.flagship.fx_ledger.fx.RatePreference;
import com.flagship.fx_ledger.fx.RateQuote;
import com.flagship.fx_ledger.fx.RateResolver;
import com.flagship.fx_ledger.fx.RateSourceKind;
import com.flagship.fx_ledger.fx.RateUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(FxController.class)
class FxControllerTest {

    private static final Instant AS_OF = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RateResolver rateResolver;

    @Test
    @DisplayName("GET /rates returns the live quote")
    void testLiveRate() throws Exception {
        when(rateResolver.resolveRate(CurrencyCode.USD, CurrencyCode.EUR, RatePreference.LIVE_ONLY))
            .thenReturn(new RateQuote(CurrencyCode.USD, CurrencyCode.EUR, new BigDecimal("0.92"),
                RateSourceKind.LIVE, AS_OF));

        mockMvc.perform(get("/api/fx/rates/usd/eur"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.from").value("USD"))
            .andExpect(jsonPath("$.to").value("EUR"))
            .andExpect(jsonPath("$.rate").value(0.92))
            .andExpect(jsonPath("$.source").value("LIVE"))
            .andExpect(jsonPath("$.as_of").value("2026-03-01T12:00:00Z"));
    }

    @Test
    @DisplayName("allowFallback=true asks for a fallback quote")
    void testFallbackRate() throws Exception {
        when(rateResolver.resolveRate(CurrencyCode.NGN, CurrencyCode.USD, RatePreference.ALLOW_FALLBACK))
            .thenReturn(new RateQuote(CurrencyCode.NGN, CurrencyCode.USD, new BigDecimal("0.0021"),
                RateSourceKind.FALLBACK, AS_OF));

        mockMvc.perform(get("/api/fx/rates/NGN/USD").param("allowFallback", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.source").value("FALLBACK"));
    }

    @Test
    @DisplayName("Unavailable rate is 503 RATE_UNAVAILABLE")
    void testRateUnavailable() throws Exception {
        when(rateResolver.resolveRate(any(), any(), any()))
            .thenThrow(new RateUnavailableException("Exchange rates for GBP are unavailable"));

        mockMvc.perform(get("/api/fx/rates/GBP/NGN"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("RATE_UNAVAILABLE"))
            .andExpect(jsonPath("$.details.retryable").value("true"));
    }

    @Test
    @DisplayName("Unsupported currency in the path is 400")
    void testUnsupportedCurrency() throws Exception {
        mockMvc.perform(get("/api/fx/rates/USD/XYZ"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("UNSUPPORTED_CURRENCY"));
    }

    @Test
    @DisplayName("GET /convert returns the converted amount")
    void testConvert() throws Exception {
        when(rateResolver.convert(CurrencyCode.USD, CurrencyCode.GBP, new BigDecimal("250")))
            .thenReturn(Conversion.of(CurrencyCode.USD, CurrencyCode.GBP, new BigDecimal("250"), new BigDecimal("0.79")));

        mockMvc.perform(get("/api/fx/convert")
                .param("from", "USD")
                .param("to", "GBP")
                .param("amount", "250"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.converted_amount").value(197.5))
            .andExpect(jsonPath("$.rate").value(0.79));
    }

    @Test
    @DisplayName("Invalid conversion amount is 400")
    void testConvert_InvalidAmount() throws Exception {
        when(rateResolver.convert(any(), any(), any()))
            .thenThrow(new IllegalArgumentException("Amount must be greater than zero"));

        mockMvc.perform(get("/api/fx/convert")
                .param("from", "USD")
                .param("to", "GBP")
                .param("amount", "-1"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/fx/convert").param("from", "USD").param("to", "GBP"))
            .andExpect(status().isBadRequest());
    }
}
