package com.flagship.fx_ledger.fx;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Bounded synchronous retry with exponential backoff, built on Resilience4j.
 *
 * The calling thread sleeps between attempts; other threads are unaffected.
 * After the last attempt the final exception propagates unchanged.
 * {@link RateFetchException}s flagged as non-retryable end the loop at once.
 */
@Slf4j
public class RetryPolicy {

    @Getter
    private final RetryConfig config;
    private final Map<String, Retry> retries = new ConcurrentHashMap<>();

    public RetryPolicy(int maxAttempts, Duration initialDelay, double backoffFactor, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.config = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                initialDelay.toMillis(), backoffFactor, maxDelay.toMillis()))
            .retryOnException(RetryPolicy::isRetryable)
            .build();
    }

    public static RetryPolicy from(FxProperties.Retry settings) {
        return new RetryPolicy(settings.getMaxAttempts(), settings.getInitialDelay(),
            settings.getBackoffFactor(), settings.getMaxDelay());
    }

    /**
     * Runs {@code call}, retrying failures under the operation's retry instance.
     */
    public <T> T execute(String operation, Supplier<T> call) {
        return retries.computeIfAbsent(operation, this::newRetry).executeSupplier(call);
    }

    private Retry newRetry(String operation) {
        Retry retry = Retry.of(operation, config);
        retry.getEventPublisher()
            .onRetry(event -> log.warn("Retry attempt {} for {} in {}ms: {}",
                event.getNumberOfRetryAttempts(), operation,
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"))
            .onError(event -> log.error("{} failed after {} attempts: {}",
                operation, event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    static boolean isRetryable(Throwable error) {
        return !(error instanceof RateFetchException fetch) || fetch.isRetryable();
    }
}
