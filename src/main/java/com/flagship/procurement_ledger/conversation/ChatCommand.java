package com.flagship.procurement_ledger.conversation;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Commands understood by the bot. Each command also answers to the German names
 * the bot was first rolled out with.
 */
public enum ChatCommand {
    START("start"),
    PENDING("pending", "meine_bestellungen", "bestellungen"),
    WITHDRAW("withdraw", "stornieren"),
    SEARCH("search", "suche"),
    STATS("stats", "statistik"),
    ABORT("abort", "abbrechen", "cancel"),
    MY_ID("myid", "meine_id"),
    HELP("help", "hilfe"),
    SKIP("skip", "weiter");

    private final List<String> names;

    ChatCommand(String... names) {
        this.names = List.of(names);
    }

    public String primaryName() {
        return names.get(0);
    }

    /**
     * Resolves a command name as typed: a leading slash and a {@code @botname}
     * suffix are ignored, matching is case-insensitive.
     */
    public static Optional<ChatCommand> fromName(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String name = raw.strip();
        if (name.startsWith("/")) {
            name = name.substring(1);
        }
        int at = name.indexOf('@');
        if (at >= 0) {
            name = name.substring(0, at);
        }
        name = name.toLowerCase(Locale.ROOT);

        for (ChatCommand command : values()) {
            if (command.names.contains(name)) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}
