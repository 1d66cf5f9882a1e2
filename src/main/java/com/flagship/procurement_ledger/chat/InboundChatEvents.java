package com.flagship.procurement_ledger.chat;

import com.flagship.procurement_ledger.conversation.ChatEventDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Shared intake for inbound envelopes from any transport adapter:
 * de-duplicate, convert, dispatch. An event whose dispatch fails is released
 * again so that its redelivery is not taken for a duplicate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboundChatEvents {

    public enum Outcome {
        PROCESSED,
        DUPLICATE
    }

    private final InboundEventDeduplicator deduplicator;
    private final ChatEventDispatcher dispatcher;

    /**
     * @throws IllegalArgumentException if the envelope does not describe a valid event
     */
    public Outcome accept(ChatEventEnvelope envelope) {
        ChatEvent event = envelope.toEvent();

        if (!deduplicator.claim(envelope.getEventId())) {
            return Outcome.DUPLICATE;
        }

        try {
            dispatcher.dispatch(event);
        } catch (RuntimeException e) {
            deduplicator.release(envelope.getEventId());
            throw e;
        }
        return Outcome.PROCESSED;
    }
}
