package com.flagship.procurement_ledger.ledger;

/**
 * Lifecycle state of a request, derived from the free-text fulfillment status cell.
 *
 * The engine only ever writes {@link #CANCELLED_STATUS}; any other non-empty value is
 * a manual edit by whoever placed the order and means the request was fulfilled.
 */
public enum FulfillmentState {
    PENDING,
    FULFILLED,
    CANCELLED;

    public static final String CANCELLED_STATUS = "CANCELLED";

    // Marker written by the earlier German-language tooling for the same sheet.
    static final String LEGACY_CANCELLED_STATUS = "STORNIERT";

    public static FulfillmentState classify(String status) {
        if (status == null || status.isBlank()) {
            return PENDING;
        }
        // Case-sensitive: a hand-typed "cancelled" counts as fulfilled.
        String trimmed = status.strip();
        if (trimmed.equals(CANCELLED_STATUS) || trimmed.equals(LEGACY_CANCELLED_STATUS)) {
            return CANCELLED;
        }
        return FULFILLED;
    }
}
