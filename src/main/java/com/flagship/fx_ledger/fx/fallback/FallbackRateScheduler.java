package com.flagship.fx_ledger.fx.fallback;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Hourly trigger for the fallback refresh cycle.
 *
 * Failures are logged here and never propagate; the table keeps serving its
 * previous (possibly stale) rates until a later cycle succeeds.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "fx.fallback.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class FallbackRateScheduler {

    private final FallbackRateRefresher refresher;

    @Scheduled(fixedRateString = "${fx.fallback.refresh-interval:3600000}",
               initialDelayString = "${fx.fallback.refresh-interval:3600000}")
    public void refreshStaleRates() {
        try {
            refresher.refreshIfStale()
                .ifPresent(result -> log.info("Scheduled fallback refresh completed from {}", result.getSource()));
        } catch (Exception e) {
            log.error("Scheduled fallback refresh failed: {}", e.getMessage(), e);
        }
    }
}
