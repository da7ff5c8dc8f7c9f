package com.flagship.fx_ledger.fx;

import com.flagship.fx_ledger.fx.source.RateSourceType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Rate resolution settings bound from {@code fx.*}.
 */
@ConfigurationProperties(prefix = "fx")
@Getter
@Setter
public class FxProperties {

    private Provider provider = new Provider();
    private Cache cache = new Cache();
    private Retry retry = new Retry();
    private Fallback fallback = new Fallback();
    private Sources sources = new Sources();
    private Sanity sanity = new Sanity();

    /**
     * Primary live rate provider, queried as {@code {baseUrl}/latest/{base}}.
     */
    @Getter
    @Setter
    public static class Provider {
        private String baseUrl;
        private String apiKey;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank() && apiKey != null && !apiKey.isBlank();
        }
    }

    @Getter
    @Setter
    public static class Cache {
        private Duration ttl = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private double backoffFactor = 2.0;
        private Duration maxDelay = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Fallback {
        private Duration maxAge = Duration.ofHours(1);
        private BigDecimal significantChangePercent = BigDecimal.valueOf(5);
        /** Exclusive upper bound for a valid rate. */
        private BigDecimal maxRate = BigDecimal.valueOf(1_000_000);
        private List<RateSourceType> sources = new ArrayList<>(
            List.of(RateSourceType.EXCHANGE_RATES_API, RateSourceType.FIXER));
        /** Scheduler period in milliseconds. */
        private long refreshInterval = 3_600_000L;
    }

    @Getter
    @Setter
    public static class Sources {
        private Source exchangeRatesApi = new Source();
        private Source fixer = new Source("http://data.fixer.io/api", "EUR");
    }

    @Getter
    @Setter
    public static class Source {
        private String baseUrl;
        private String apiKey;
        private String base = "USD";

        public Source() {
        }

        public Source(String baseUrl, String base) {
            this.baseUrl = baseUrl;
            this.base = base;
        }

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank() && apiKey != null && !apiKey.isBlank();
        }
    }

    /**
     * Guard against gross mispricing of trades. A live rate is rejected when it
     * differs from the fallback rate by more than this factor in either
     * direction. Zero disables the check.
     */
    @Getter
    @Setter
    public static class Sanity {
        private BigDecimal maxDeviationFactor = BigDecimal.ZERO;

        public boolean isEnabled() {
            return maxDeviationFactor != null && maxDeviationFactor.compareTo(BigDecimal.ONE) > 0;
        }
    }
}
