package com.flagship.procurement_ledger.conversation;

/**
 * Stages of the order flow, in the order they are visited.
 */
public enum OrderStage {
    ARTICLE,
    QUANTITY,
    URGENCY,
    COST_CENTER,
    ATTACHMENT,
    CONFIRM
}
