package com.flagship.procurement_ledger.chat;

/**
 * Inbound event from the chat transport.
 *
 * All events carry the sender's identity (the opaque chat id that scopes ownership
 * of requests) and the display name that is recorded as the requester name.
 */
public interface ChatEvent {

    String getIdentity();

    String getDisplayName();

    /**
     * Short type name for logging and metrics.
     */
    String getEventType();
}
