package com.flagship.procurement_ledger.chat;

import lombok.Value;

import java.util.List;

/**
 * A slash command such as {@code /search toner}. The name is stored without the slash.
 */
@Value
public class CommandMessage implements ChatEvent {
    String identity;
    String displayName;
    String name;
    List<String> args;

    public static final String EVENT_TYPE = "command";

    public CommandMessage(String identity, String displayName, String name, List<String> args) {
        this.identity = identity;
        this.displayName = displayName;
        this.name = name;
        this.args = args == null ? List.of() : List.copyOf(args);
    }

    /**
     * Arguments joined with single spaces, empty if there are none.
     */
    public String argumentText() {
        return String.join(" ", args).strip();
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
