package com.flagship.fx_ledger.ledger.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fx_ledger.config.JacksonConfig;
import com.flagship.fx_ledger.config.LedgerProperties;
import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.ledger.EntryKind;
import com.flagship.fx_ledger.ledger.LedgerEntry;
import com.flagship.fx_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KafkaLedgerNotificationSinkTest {

    private KafkaTemplate<String, String> kafkaTemplate;
    private SimpleMeterRegistry registry;
    private ObjectMapper objectMapper;
    private KafkaLedgerNotificationSink sink;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        registry = new SimpleMeterRegistry();
        objectMapper = new JacksonConfig().objectMapper();
        sink = new KafkaLedgerNotificationSink(kafkaTemplate, objectMapper,
            new LedgerMetrics(registry), new LedgerProperties());
    }

    private static LedgerNotification notification() {
        LedgerEntry entry = LedgerEntry.pending("alice", EntryKind.FUNDING, CurrencyCode.USD, CurrencyCode.USD,
            new BigDecimal("25"), null, "funding").completeAtPar();
        return LedgerNotification.from(entry, "corr-1");
    }

    private double notifications(String status) {
        return registry.counter("ledger.notifications", "status", status).count();
    }

    @Test
    @DisplayName("Notification is sent as JSON keyed by owner")
    void testPublish() throws Exception {
        LedgerNotification notification = notification();
        SendResult<String, String> result = new SendResult<>(
            new ProducerRecord<>("ledger-notifications", "alice", "{}"),
            new RecordMetadata(new TopicPartition("ledger-notifications", 0), 0, 0, 0, 0, 0));
        when(kafkaTemplate.send(eq("ledger-notifications"), eq("alice"), anyString()))
            .thenReturn(CompletableFuture.completedFuture(result));

        sink.publish(notification);

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("ledger-notifications"), eq("alice"), payload.capture());
        JsonNode json = objectMapper.readTree(payload.getValue());
        assertEquals(notification.getEntryId().toString(), json.path("entryId").asText());
        assertEquals("COMPLETED", json.path("status").asText());
        assertEquals("corr-1", json.path("correlationId").asText());
        assertEquals(1.0, notifications("sent"));
    }

    @Test
    @DisplayName("Broker failure is counted and not rethrown")
    void testBrokerFailure() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertDoesNotThrow(() -> sink.publish(notification()));
        assertEquals(1.0, notifications("failed"));
    }

    @Test
    @DisplayName("Synchronous send failure is counted and not rethrown")
    void testSendThrows() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenThrow(new IllegalStateException("metadata timeout"));

        assertDoesNotThrow(() -> sink.publish(notification()));
        assertEquals(1.0, notifications("failed"));
    }
}
