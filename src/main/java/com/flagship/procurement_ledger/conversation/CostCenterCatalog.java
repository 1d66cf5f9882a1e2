package com.flagship.procurement_ledger.conversation;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Configured closed set of cost centers a request can be booked on.
 */
public class CostCenterCatalog {

    private final List<String> costCenters;

    public CostCenterCatalog(List<String> costCenters) {
        List<String> cleaned = costCenters.stream()
                .map(String::strip)
                .filter(name -> !name.isEmpty())
                .distinct()
                .toList();
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("At least one cost center must be configured");
        }
        this.costCenters = cleaned;
    }

    /**
     * Matches input case-insensitively and returns the configured spelling.
     */
    public Optional<String> resolve(String input) {
        if (input == null) {
            return Optional.empty();
        }
        String wanted = input.strip().toLowerCase(Locale.ROOT);
        return costCenters.stream()
                .filter(name -> name.toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    public List<String> options() {
        return costCenters;
    }
}
