package com.flagship.procurement_ledger.chat;

import lombok.Value;

/**
 * The user picked one of the options of an {@link OfferChoices} prompt.
 */
@Value
public class SelectionMessage implements ChatEvent {
    String identity;
    String displayName;
    String choiceToken;

    public static final String EVENT_TYPE = "selection";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
