package com.flagship.procurement_ledger.chat;

import lombok.Value;

import java.util.List;

/**
 * Plain text reply. {@code options} are quick-reply labels the transport may render
 * as a one-time keyboard; empty means the keyboard is removed.
 */
@Value
public class SendText implements OutboundMessage {
    String identity;
    String text;
    List<String> options;

    public SendText(String identity, String text, List<String> options) {
        this.identity = identity;
        this.text = text;
        this.options = options == null ? List.of() : List.copyOf(options);
    }

    public static SendText of(String identity, String text) {
        return new SendText(identity, text, List.of());
    }
}
