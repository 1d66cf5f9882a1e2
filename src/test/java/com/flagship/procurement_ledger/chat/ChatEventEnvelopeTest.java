package com.flagship.procurement_ledger.chat;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatEventEnvelopeTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Test
    @DisplayName("Command envelope parses from snake_case JSON")
    void testParseCommand() throws Exception {
        String json = "{\"event_id\":\"e-1\",\"type\":\"command\",\"identity\":\"4711\","
                + "\"display_name\":\"Max\",\"command\":\"search\",\"args\":[\"printer\",\"paper\"],"
                + "\"unknown_field\":true}";

        ChatEventEnvelope envelope = objectMapper.readValue(json, ChatEventEnvelope.class);
        ChatEvent event = envelope.toEvent();

        assertEquals("e-1", envelope.getEventId());
        CommandMessage command = assertInstanceOf(CommandMessage.class, event);
        assertEquals("4711", command.getIdentity());
        assertEquals("Max", command.getDisplayName());
        assertEquals("printer paper", command.argumentText());
    }

    @Test
    @DisplayName("Display name falls back to the identity")
    void testDisplayNameFallback() {
        ChatEventEnvelope envelope = ChatEventEnvelope.builder()
                .type("text").identity("4711").displayName(" ").text("Toner")
                .build();

        TextMessage text = assertInstanceOf(TextMessage.class, envelope.toEvent());
        assertEquals("4711", text.getDisplayName());
    }

    @Test
    @DisplayName("Each type maps to its event")
    void testTypes() {
        assertInstanceOf(PhotoMessage.class, ChatEventEnvelope.builder()
                .type("photo").identity("1").attachmentHandle("file-1").build().toEvent());
        assertInstanceOf(SelectionMessage.class, ChatEventEnvelope.builder()
                .type("selection").identity("1").choiceToken("cancel:2").build().toEvent());

        CommandMessage bare = (CommandMessage) ChatEventEnvelope.builder()
                .type("command").identity("1").command("help").build().toEvent();
        assertEquals(List.of(), bare.getArgs());
    }

    @Test
    @DisplayName("Missing payload or unknown type is rejected")
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> ChatEventEnvelope.builder()
                .type("photo").identity("1").build().toEvent());
        assertThrows(IllegalArgumentException.class, () -> ChatEventEnvelope.builder()
                .type("sticker").identity("1").build().toEvent());
        assertThrows(IllegalArgumentException.class, () -> ChatEventEnvelope.builder()
                .identity("1").text("x").build().toEvent());
    }

    @Test
    @DisplayName("Event without identity is rejected")
    void testMissingIdentity() {
        assertThrows(IllegalArgumentException.class, () -> ChatEventEnvelope.builder()
                .type("text").text("hi").build().toEvent());
        assertThrows(IllegalArgumentException.class, () -> ChatEventEnvelope.builder()
                .type("command").identity(" ").command("start").build().toEvent());
    }
}
