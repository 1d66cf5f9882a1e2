package com.flagship.procurement_ledger.ledger;

import com.flagship.procurement_ledger.store.LedgerColumn;
import com.flagship.procurement_ledger.store.LedgerRow;
import lombok.Value;

/**
 * A request as read back from the ledger, together with the physical row position
 * needed to mutate it later. Cell values are kept exactly as stored.
 */
@Value
public class LedgerRequest {
    int rowPosition;
    String orderNumber;
    String createdAt;
    String requesterName;
    String requesterIdentity;
    String article;
    String quantity;
    String urgency;
    String costCenter;
    String fulfillmentStatus;
    String fulfilledAt;
    String attachmentReference;

    public static LedgerRequest fromRow(LedgerRow row) {
        if (row.isHeader()) {
            throw new IllegalArgumentException("Header row is not a request");
        }
        return new LedgerRequest(
            row.getPosition(),
            row.cell(LedgerColumn.ORDER_NUMBER),
            row.cell(LedgerColumn.CREATED_AT),
            row.cell(LedgerColumn.REQUESTER_NAME),
            row.cell(LedgerColumn.REQUESTER_IDENTITY),
            row.cell(LedgerColumn.ARTICLE),
            row.cell(LedgerColumn.QUANTITY),
            row.cell(LedgerColumn.URGENCY),
            row.cell(LedgerColumn.COST_CENTER),
            row.cell(LedgerColumn.FULFILLMENT_STATUS),
            row.cell(LedgerColumn.FULFILLED_AT),
            row.cell(LedgerColumn.ATTACHMENT_REFERENCE)
        );
    }

    public FulfillmentState state() {
        return FulfillmentState.classify(fulfillmentStatus);
    }

    public boolean isPending() {
        return state() == FulfillmentState.PENDING;
    }
}
