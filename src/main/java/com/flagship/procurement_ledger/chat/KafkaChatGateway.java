package com.flagship.procurement_ledger.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes outbound chat messages to the outbound topic, where the transport
 * bridge picks them up.
 *
 * The chat identity is the record key so messages to one chat keep their order.
 * Sends are synchronous: a message counts as delivered once the broker acknowledged it.
 */
@Component
@Slf4j
public class KafkaChatGateway implements ChatGateway {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String outboundTopic;
    private final long sendTimeoutMs;

    public KafkaChatGateway(KafkaTemplate<String, String> kafkaTemplate,
                            ObjectMapper objectMapper,
                            @Value("${kafka.topic.chat-outbound:chat.outbound}") String outboundTopic,
                            @Value("${chat.outbound.send-timeout-ms:5000}") long sendTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.outboundTopic = outboundTopic;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Override
    public void send(OutboundMessage message) {
        String payload = serialize(message);

        try {
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(outboundTopic, message.getIdentity(), payload);

            SendResult<String, String> result = future.get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Sent {} to {}: partition={}, offset={}",
                    message.getClass().getSimpleName(),
                    message.getIdentity(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChatDeliveryException("Interrupted while sending to " + message.getIdentity(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ChatDeliveryException("Failed to send to " + message.getIdentity() + ": " + e.getMessage(), e);
        }
    }

    private String serialize(OutboundMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new ChatDeliveryException("Failed to serialize outbound message: " + e.getMessage(), e);
        }
    }
}
