package com.flagship.fx_ledger.fx;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fx_ledger.currency.CurrencyCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed {@link RateCache}. Tables are stored as JSON under
 * {@code fx:rates:{base}} with the configured TTL.
 *
 * Redis is a fast path only: when it is missing or failing, every lookup is a
 * miss and the resolver goes to the live provider.
 */
@Component
@Slf4j
public class RedisRateCache implements RateCache {

    private static final String KEY_PREFIX = "fx:rates:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisRateCache(Optional<StringRedisTemplate> redisTemplate,
                          ObjectMapper objectMapper,
                          FxProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = properties.getCache().getTtl();
    }

    @Override
    public Optional<ExchangeRateTable> get(CurrencyCode base) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.get().opsForValue().get(KEY_PREFIX + base.name());
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, ExchangeRateTable.class));
        } catch (Exception e) {
            log.warn("Rate cache lookup failed for {}. Treating as miss. Error: {}", base, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(ExchangeRateTable table) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                .set(KEY_PREFIX + table.getBase().name(), objectMapper.writeValueAsString(table), ttl);
        } catch (Exception e) {
            log.warn("Failed to cache rates for {}: {}", table.getBase(), e.getMessage());
        }
    }
}
