package com.flagship.procurement_ledger.chat;

import com.flagship.procurement_ledger.conversation.ChatEventDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Claim, convert and dispatch of inbound envelopes.
 */
class InboundChatEventsTest {

    private InboundEventDeduplicator deduplicator;
    private ChatEventDispatcher dispatcher;
    private InboundChatEvents inboundEvents;

    @BeforeEach
    void setUp() {
        deduplicator = mock(InboundEventDeduplicator.class);
        dispatcher = mock(ChatEventDispatcher.class);
        inboundEvents = new InboundChatEvents(deduplicator, dispatcher);
    }

    @Test
    @DisplayName("Claimed event is dispatched and kept claimed")
    void testProcessed() {
        when(deduplicator.claim("e-1")).thenReturn(true);

        assertEquals(InboundChatEvents.Outcome.PROCESSED, inboundEvents.accept(envelope("e-1")));

        verify(dispatcher).dispatch(any());
        verify(deduplicator, never()).release(any());
    }

    @Test
    @DisplayName("Already claimed event is not dispatched")
    void testDuplicate() {
        when(deduplicator.claim("e-1")).thenReturn(false);

        assertEquals(InboundChatEvents.Outcome.DUPLICATE, inboundEvents.accept(envelope("e-1")));

        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("Failed dispatch releases the claim so the redelivery is processed")
    void testFailedDispatchReleasesClaim() {
        when(deduplicator.claim("e-2")).thenReturn(true);
        doThrow(new IllegalStateException("boom")).when(dispatcher).dispatch(any());

        assertThrows(IllegalStateException.class, () -> inboundEvents.accept(envelope("e-2")));

        verify(deduplicator).release("e-2");
    }

    private static ChatEventEnvelope envelope(String eventId) {
        return ChatEventEnvelope.builder()
                .eventId(eventId)
                .type("text")
                .identity("4711")
                .text("Toner")
                .build();
    }
}
