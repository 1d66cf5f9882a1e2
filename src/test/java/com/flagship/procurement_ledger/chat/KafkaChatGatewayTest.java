package com.flagship.procurement_ledger.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class KafkaChatGatewayTest {

    private static final String TOPIC = "chat.outbound";

    private KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private KafkaChatGateway gateway;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        gateway = new KafkaChatGateway(kafkaTemplate, objectMapper, TOPIC, 1000);
    }

    @Test
    @DisplayName("Message is keyed by chat identity and tagged with its type")
    void testSendChoices() throws Exception {
        when(kafkaTemplate.send(eq(TOPIC), eq("4711"), anyString())).thenReturn(acknowledged("4711"));

        gateway.send(new OfferChoices("4711", "Urgent or normal?",
                List.of(new ChoiceOption("🔴 Urgent", "urgency:URGENT"))));

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("4711"), payload.capture());
        JsonNode json = objectMapper.readTree(payload.getValue());
        assertEquals("choices", json.get("type").asText());
        assertEquals("urgency:URGENT", json.get("options").get(0).get("token").asText());
    }

    @Test
    @DisplayName("Broker failure surfaces as a delivery exception")
    void testBrokerFailure() {
        when(kafkaTemplate.send(eq(TOPIC), eq("4711"), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        ChatDeliveryException e = assertThrows(ChatDeliveryException.class,
                () -> gateway.send(SendText.of("4711", "hello")));
        assertTrue(e.getMessage().contains("4711"));
    }

    private static CompletableFuture<SendResult<String, String>> acknowledged(String key) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(
                new SendResult<>(new ProducerRecord<>(TOPIC, key, "payload"), metadata));
    }
}
