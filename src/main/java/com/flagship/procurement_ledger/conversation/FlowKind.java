package com.flagship.procurement_ledger.conversation;

public enum FlowKind {
    ORDER,
    CANCELLATION
}
