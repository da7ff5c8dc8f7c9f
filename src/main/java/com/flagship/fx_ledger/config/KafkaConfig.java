package com.flagship.fx_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for ledger notifications.
 */
@Configuration
public class KafkaConfig {

    /**
     * Creates the notifications topic if it doesn't exist.
     * Keyed by owner, so partitions keep each owner's notifications in order.
     */
    @Bean
    public NewTopic ledgerNotificationsTopic(LedgerProperties properties) {
        return TopicBuilder.name(properties.getNotifications().getTopic())
                .partitions(3)
                .replicas(1)
                .build();
    }
}
