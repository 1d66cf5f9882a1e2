package com.flagship.procurement_ledger.chat;

/**
 * Thrown when an outbound chat message could not be handed to the transport.
 */
public class ChatDeliveryException extends RuntimeException {

    public ChatDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
