package com.flagship.procurement_ledger.notification;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for request lifecycle events.
 *
 * Events are published in-process after the ledger call returned and are
 * consumed asynchronously, so a slow or failing consumer never affects the
 * reply the requester already received.
 */
public interface ProcurementEvent {

    /**
     * Unique identifier for this event instance.
     */
    UUID getEventId();

    /**
     * Formatted order number of the request this event is about.
     */
    String getOrderNumber();

    Instant getOccurredAt();

    /**
     * Event type name, used as metric tag.
     */
    String getEventType();
}
