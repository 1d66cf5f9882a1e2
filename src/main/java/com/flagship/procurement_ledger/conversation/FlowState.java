package com.flagship.procurement_ledger.conversation;

/**
 * Scratch state of one active multi-step flow. An identity has at most one.
 */
public interface FlowState {

    FlowKind kind();
}
