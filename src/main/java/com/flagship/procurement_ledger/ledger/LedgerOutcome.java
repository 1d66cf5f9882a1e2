package com.flagship.procurement_ledger.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of a ledger operation: either a value, or "unavailable" when the backing
 * store failed. Callers show a neutral "try again later" message for the latter.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerOutcome<T> {
    boolean available;
    T value;

    public static <T> LedgerOutcome<T> ok(T value) {
        return new LedgerOutcome<>(true, value);
    }

    public static <T> LedgerOutcome<T> unavailable() {
        return new LedgerOutcome<>(false, null);
    }

    public T orElse(T fallback) {
        return available ? value : fallback;
    }
}
