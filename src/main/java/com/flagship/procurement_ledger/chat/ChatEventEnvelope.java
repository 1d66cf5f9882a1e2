package com.flagship.procurement_ledger.chat;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Wire format of an inbound chat event, shared by the Kafka topic and the HTTP endpoint.
 *
 * <pre>
 * {"event_id": "...", "type": "command", "identity": "4711", "display_name": "Max",
 *  "command": "search", "args": ["toner"]}
 * </pre>
 *
 * {@code event_id} is optional; when present it is used to drop redeliveries.
 */
@Value
@Builder
@Jacksonized
public class ChatEventEnvelope {

    @JsonProperty("event_id")
    String eventId;

    @NotBlank(message = "Type is required")
    @Pattern(regexp = "text|photo|command|selection", message = "Type must be text, photo, command or selection")
    @JsonProperty("type")
    String type;

    @NotBlank(message = "Identity is required")
    @JsonProperty("identity")
    String identity;

    @JsonProperty("display_name")
    String displayName;

    @JsonProperty("text")
    String text;

    @JsonProperty("attachment_handle")
    String attachmentHandle;

    @JsonProperty("command")
    String command;

    @JsonProperty("args")
    List<String> args;

    @JsonProperty("choice_token")
    String choiceToken;

    /**
     * Converts the envelope into a typed event.
     *
     * @throws IllegalArgumentException if the identity is missing, the type is unknown
     *         or its payload field is missing
     */
    public ChatEvent toEvent() {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Chat event identity is missing");
        }
        String name = displayName == null || displayName.isBlank() ? identity : displayName.strip();
        if (type == null) {
            throw new IllegalArgumentException("Chat event type is missing");
        }
        return switch (type) {
            case TextMessage.EVENT_TYPE -> new TextMessage(identity, name, require(text, "text"));
            case PhotoMessage.EVENT_TYPE -> new PhotoMessage(identity, name, require(attachmentHandle, "attachment_handle"));
            case CommandMessage.EVENT_TYPE -> new CommandMessage(identity, name, require(command, "command"), args);
            case SelectionMessage.EVENT_TYPE -> new SelectionMessage(identity, name, require(choiceToken, "choice_token"));
            default -> throw new IllegalArgumentException("Unknown chat event type: " + type);
        };
    }

    private static String require(String value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("Field '" + field + "' is required for this event type");
        }
        return value;
    }
}
