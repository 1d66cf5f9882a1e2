package com.flagship.procurement_ledger.chat;

/**
 * Outbound side of the chat transport.
 */
public interface ChatGateway {

    /**
     * Delivers a message.
     *
     * @throws ChatDeliveryException if the transport did not accept the message
     */
    void send(OutboundMessage message);
}
