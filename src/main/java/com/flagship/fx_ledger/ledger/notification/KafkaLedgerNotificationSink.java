package com.flagship.fx_ledger.ledger.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fx_ledger.config.LedgerProperties;
import com.flagship.fx_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes ledger notifications as JSON to Kafka, keyed by owner so that one
 * owner's notifications stay ordered within a partition.
 *
 * Sends are asynchronous. Serialization errors, synchronous send errors and
 * broker failures are logged and counted, never rethrown.
 */
@Component
@Slf4j
public class KafkaLedgerNotificationSink implements LedgerNotificationSink {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;
    private final String topic;

    public KafkaLedgerNotificationSink(KafkaTemplate<String, String> kafkaTemplate,
                                       ObjectMapper objectMapper,
                                       LedgerMetrics metrics,
                                       LedgerProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.topic = properties.getNotifications().getTopic();
    }

    @Override
    public void publish(LedgerNotification notification) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize notification for entry {}: {}",
                    notification.getEntryId(), e.getMessage());
            metrics.recordNotificationFailed();
            return;
        }

        try {
            kafkaTemplate.send(topic, notification.getOwnerId(), payload)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("Failed to publish notification: entryId={}, status={}, error={}",
                                notification.getEntryId(), notification.getStatus(), error.getMessage());
                        metrics.recordNotificationFailed();
                    } else {
                        log.debug("Published notification: entryId={}, partition={}, offset={}",
                                notification.getEntryId(),
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                        metrics.recordNotificationSent();
                    }
                });
        } catch (RuntimeException e) {
            log.error("Failed to hand notification for entry {} to Kafka: {}",
                    notification.getEntryId(), e.getMessage());
            metrics.recordNotificationFailed();
        }
    }
}
