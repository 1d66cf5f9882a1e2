package com.flagship.procurement_ledger.chat;

import lombok.Value;

import java.util.List;

/**
 * Prompt with mutually exclusive options. The chosen option comes back as a
 * {@link SelectionMessage} carrying the option's token.
 */
@Value
public class OfferChoices implements OutboundMessage {
    String identity;
    String prompt;
    List<ChoiceOption> options;

    public OfferChoices(String identity, String prompt, List<ChoiceOption> options) {
        this.identity = identity;
        this.prompt = prompt;
        this.options = List.copyOf(options);
    }
}
