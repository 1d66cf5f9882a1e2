package com.flagship.procurement_ledger.chat;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Message sent back through the chat transport.
 * Serialized with a {@code type} discriminator for the outbound topic.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SendText.class, name = "text"),
    @JsonSubTypes.Type(value = SendPhoto.class, name = "photo"),
    @JsonSubTypes.Type(value = OfferChoices.class, name = "choices")
})
public interface OutboundMessage {

    /**
     * Chat the message is addressed to.
     */
    String getIdentity();
}
