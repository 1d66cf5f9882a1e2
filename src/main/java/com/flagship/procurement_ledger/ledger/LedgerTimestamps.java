package com.flagship.procurement_ledger.ledger;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Text formats of the timestamp cells. Values are local times in the configured zone.
 */
public final class LedgerTimestamps {

    public static final DateTimeFormatter CREATED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    public static final DateTimeFormatter FULFILLED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private LedgerTimestamps() {
        // Utility class
    }

    public static String formatCreatedAt(LocalDateTime time) {
        return CREATED_AT.format(time);
    }

    public static String formatFulfilledAt(LocalDateTime time) {
        return FULFILLED_AT.format(time);
    }

    /**
     * Parses a {@code created_at} cell; empty for blank or malformed values.
     */
    public static Optional<LocalDateTime> parseCreatedAt(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(value.trim(), CREATED_AT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
