package com.flagship.procurement_ledger.notification;

import com.flagship.procurement_ledger.ledger.NewRequest;
import com.flagship.procurement_ledger.ledger.OrderNumber;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a request was durably appended to the ledger.
 */
@Value
public class RequestSubmittedEvent implements ProcurementEvent {
    UUID eventId;
    String orderNumber;
    String requesterName;
    String requesterIdentity;
    String article;
    String quantity;
    String urgency;
    String costCenter;
    String attachmentReference;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RequestSubmitted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public boolean hasAttachment() {
        return attachmentReference != null && !attachmentReference.isBlank();
    }

    public static RequestSubmittedEvent of(OrderNumber orderNumber, NewRequest request, Instant occurredAt) {
        return new RequestSubmittedEvent(
            UUID.randomUUID(),
            orderNumber.format(),
            request.getRequesterName(),
            request.getRequesterIdentity(),
            request.getArticle(),
            request.getQuantity(),
            request.getUrgency().label(),
            request.getCostCenter(),
            request.getAttachmentReference(),
            occurredAt
        );
    }
}
