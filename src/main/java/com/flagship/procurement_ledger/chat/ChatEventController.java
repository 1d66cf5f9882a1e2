package com.flagship.procurement_ledger.chat;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * HTTP intake for chat events, for transport bridges that push via webhook
 * instead of Kafka. Replies still go out through the {@link ChatGateway}.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatEventController {

    private final InboundChatEvents inboundEvents;

    @PostMapping("/events")
    public ResponseEntity<Map<String, String>> receive(@Valid @RequestBody ChatEventEnvelope envelope) {
        log.debug("Received {} event over HTTP", envelope.getType());
        InboundChatEvents.Outcome outcome = inboundEvents.accept(envelope);
        return ResponseEntity.accepted().body(Map.of("result", outcome.name()));
    }
}
