package com.flagship.fx_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Ledger engine settings bound from {@code ledger.*}.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    /**
     * {@code jpa} for database row locks, {@code in-memory} for a process-local key mutex table.
     */
    private String balanceStore = "jpa";

    /**
     * Bounded wait for acquiring exclusive holds.
     */
    private Duration holdTimeout = Duration.ofSeconds(5);

    private Notifications notifications = new Notifications();

    @Getter
    @Setter
    public static class Notifications {
        private String topic = "ledger-notifications";
    }
}
