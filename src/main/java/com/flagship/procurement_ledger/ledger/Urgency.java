package com.flagship.procurement_ledger.ledger;

import java.util.Locale;
import java.util.Optional;

/**
 * Urgency of a request. Closed set: anything else is rejected at input time.
 */
public enum Urgency {
    URGENT("Urgent", "Dringend"),
    NORMAL("Normal", "Normal");

    public static final String TOKEN_PREFIX = "urgency:";

    private final String label;
    private final String legacyLabel;

    Urgency(String label, String legacyLabel) {
        this.label = label;
        this.legacyLabel = legacyLabel;
    }

    /**
     * Value written to the ledger and shown to users.
     */
    public String label() {
        return label;
    }

    public String token() {
        return TOKEN_PREFIX + name();
    }

    /**
     * Resolves typed input such as {@code "normal"} or {@code "🔴 Dringend"}.
     * Leading symbols (keyboard emoji) and surrounding blanks are ignored.
     */
    public static Optional<Urgency> fromInput(String input) {
        if (input == null) {
            return Optional.empty();
        }
        String cleaned = stripLeadingSymbols(input).toLowerCase(Locale.ROOT);
        for (Urgency urgency : values()) {
            if (cleaned.equals(urgency.label.toLowerCase(Locale.ROOT))
                || cleaned.equals(urgency.legacyLabel.toLowerCase(Locale.ROOT))
                || cleaned.equals(urgency.name().toLowerCase(Locale.ROOT))) {
                return Optional.of(urgency);
            }
        }
        return Optional.empty();
    }

    public static Optional<Urgency> fromToken(String token) {
        if (token == null || !token.startsWith(TOKEN_PREFIX)) {
            return Optional.empty();
        }
        String name = token.substring(TOKEN_PREFIX.length());
        for (Urgency urgency : values()) {
            if (urgency.name().equals(name)) {
                return Optional.of(urgency);
            }
        }
        return Optional.empty();
    }

    private static String stripLeadingSymbols(String input) {
        String trimmed = input.strip();
        int start = 0;
        while (start < trimmed.length()) {
            int codePoint = trimmed.codePointAt(start);
            if (Character.isLetter(codePoint)) {
                break;
            }
            start += Character.charCount(codePoint);
        }
        return trimmed.substring(start).strip();
    }
}
