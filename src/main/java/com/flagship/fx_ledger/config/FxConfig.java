package com.flagship.fx_ledger.config;

import com.flagship.fx_ledger.fx.FxProperties;
import com.flagship.fx_ledger.fx.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Beans shared by the rate resolution pipeline.
 */
@Configuration
@Slf4j
public class FxConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * HTTP client for the live provider and the rate source adapters.
     */
    @Bean
    public RestTemplate fxRestTemplate(RestTemplateBuilder builder, FxProperties properties) {
        return builder
            .setConnectTimeout(properties.getProvider().getConnectTimeout())
            .setReadTimeout(properties.getProvider().getReadTimeout())
            .build();
    }

    @Bean
    public RetryPolicy rateRetryPolicy(FxProperties properties) {
        FxProperties.Retry retry = properties.getRetry();
        log.info("Rate retry policy: maxAttempts={}, initialDelay={}, backoffFactor={}, maxDelay={}",
                retry.getMaxAttempts(), retry.getInitialDelay(), retry.getBackoffFactor(), retry.getMaxDelay());
        return RetryPolicy.from(retry);
    }
}
