package com.flagship.procurement_ledger.ledger;

import com.flagship.procurement_ledger.store.LedgerColumn;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fields collected by the conversation, ready to be appended to the ledger.
 * The order number and creation time are assigned by {@link RequestLedger}.
 */
@Value
@Builder
public class NewRequest {
    String requesterName;
    String requesterIdentity;
    String article;
    String quantity;
    Urgency urgency;
    String costCenter;
    String attachmentReference;

    public boolean hasAttachment() {
        return attachmentReference != null && !attachmentReference.isBlank();
    }

    /**
     * Builds the full row for this request; fulfillment columns start empty.
     */
    List<String> toCells(OrderNumber orderNumber, LocalDateTime createdAt) {
        Objects.requireNonNull(urgency, "urgency");
        List<String> cells = new ArrayList<>(Collections.nCopies(LedgerColumn.count(), ""));
        cells.set(LedgerColumn.ORDER_NUMBER.index(), orderNumber.format());
        cells.set(LedgerColumn.CREATED_AT.index(), LedgerTimestamps.formatCreatedAt(createdAt));
        cells.set(LedgerColumn.REQUESTER_NAME.index(), nullToEmpty(requesterName));
        cells.set(LedgerColumn.REQUESTER_IDENTITY.index(), nullToEmpty(requesterIdentity));
        cells.set(LedgerColumn.ARTICLE.index(), nullToEmpty(article));
        cells.set(LedgerColumn.QUANTITY.index(), nullToEmpty(quantity));
        cells.set(LedgerColumn.URGENCY.index(), urgency.label());
        cells.set(LedgerColumn.COST_CENTER.index(), nullToEmpty(costCenter));
        cells.set(LedgerColumn.ATTACHMENT_REFERENCE.index(), nullToEmpty(attachmentReference));
        return cells;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
