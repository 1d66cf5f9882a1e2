package com.flagship.procurement_ledger.chat;

import lombok.Value;

@Value
public class TextMessage implements ChatEvent {
    String identity;
    String displayName;
    String text;

    public static final String EVENT_TYPE = "text";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
