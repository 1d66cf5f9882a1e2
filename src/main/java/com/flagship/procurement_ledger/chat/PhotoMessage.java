package com.flagship.procurement_ledger.chat;

import lombok.Value;

/**
 * A photo sent by the user. The handle is opaque and only meaningful to the transport.
 */
@Value
public class PhotoMessage implements ChatEvent {
    String identity;
    String displayName;
    String attachmentHandle;

    public static final String EVENT_TYPE = "photo";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
