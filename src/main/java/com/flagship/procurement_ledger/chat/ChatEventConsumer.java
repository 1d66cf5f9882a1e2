package com.flagship.procurement_ledger.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.procurement_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for inbound chat events.
 *
 * Records are keyed by chat identity, so one user's events arrive in order on a
 * single partition while different users are processed concurrently.
 *
 * Offsets are acknowledged manually once an event was handled. Unparsable
 * records are acknowledged and skipped; anything else propagates so the
 * record is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ChatEventConsumer {

    private final InboundChatEvents inboundEvents;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.chat-inbound:chat.inbound}",
        groupId = "${spring.kafka.consumer.group-id:procurement-ledger-chat}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.generateCorrelationId());
        log.debug("Received chat event: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

        try {
            ChatEventEnvelope envelope = parse(record.value());
            if (envelope == null) {
                ack.acknowledge();
                return;
            }

            InboundChatEvents.Outcome outcome = inboundEvents.accept(envelope);
            ack.acknowledge();
            log.debug("Chat event at offset {} {}", record.offset(), outcome);

        } catch (IllegalArgumentException e) {
            log.warn("Invalid chat event at offset {}, acknowledging to skip: {}", record.offset(), e.getMessage());
            ack.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error processing chat event at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    private ChatEventEnvelope parse(String json) {
        try {
            return objectMapper.readValue(json, ChatEventEnvelope.class);
        } catch (JsonProcessingException e) {
            log.warn("Could not parse chat event, acknowledging to skip: {}", e.getOriginalMessage());
            return null;
        }
    }
}
