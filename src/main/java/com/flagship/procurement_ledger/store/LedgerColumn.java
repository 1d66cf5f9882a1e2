package com.flagship.procurement_ledger.store;

/**
 * Columns of the ledger table, in their physical order.
 *
 * The first ten columns are the fixed request layout. {@link #ATTACHMENT_REFERENCE}
 * trails them so that readers of the original ten-column layout keep working.
 *
 * Only {@link #FULFILLMENT_STATUS} and {@link #FULFILLED_AT} are ever written after
 * the row has been appended.
 */
public enum LedgerColumn {
    ORDER_NUMBER("order_number", "Order No.", false),
    CREATED_AT("created_at", "Created At", false),
    REQUESTER_NAME("requester_name", "Requester", false),
    REQUESTER_IDENTITY("requester_identity", "Chat Id", false),
    ARTICLE("article", "Article", false),
    QUANTITY("quantity", "Quantity", false),
    URGENCY("urgency", "Urgency", false),
    COST_CENTER("cost_center", "Cost Center", false),
    FULFILLMENT_STATUS("fulfillment_status", "Ordered?", true),
    FULFILLED_AT("fulfilled_at", "Ordered At", true),
    ATTACHMENT_REFERENCE("attachment_reference", "Attachment", false);

    private final String sqlName;
    private final String headerTitle;
    private final boolean mutable;

    LedgerColumn(String sqlName, String headerTitle, boolean mutable) {
        this.sqlName = sqlName;
        this.headerTitle = headerTitle;
        this.mutable = mutable;
    }

    public String sqlName() {
        return sqlName;
    }

    public String headerTitle() {
        return headerTitle;
    }

    public boolean isMutable() {
        return mutable;
    }

    /**
     * Zero-based index of this column within a row's cell list.
     */
    public int index() {
        return ordinal();
    }

    public static int count() {
        return values().length;
    }
}
