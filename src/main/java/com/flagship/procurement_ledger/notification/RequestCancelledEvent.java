package com.flagship.procurement_ledger.notification;

import com.flagship.procurement_ledger.ledger.LedgerRequest;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when the owner cancelled one of their pending requests.
 */
@Value
public class RequestCancelledEvent implements ProcurementEvent {
    UUID eventId;
    String orderNumber;
    String cancelledBy;
    String requesterIdentity;
    String article;
    String quantity;
    int rowPosition;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RequestCancelled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    /**
     * @param request the request as listed before the cancellation
     * @param cancelledBy display name of the user who cancelled
     */
    public static RequestCancelledEvent of(LedgerRequest request, String cancelledBy, Instant occurredAt) {
        return new RequestCancelledEvent(
            UUID.randomUUID(),
            request.getOrderNumber(),
            cancelledBy,
            request.getRequesterIdentity(),
            request.getArticle(),
            request.getQuantity(),
            request.getRowPosition(),
            occurredAt
        );
    }
}
