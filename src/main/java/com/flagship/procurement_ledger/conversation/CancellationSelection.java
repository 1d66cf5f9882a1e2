package com.flagship.procurement_ledger.conversation;

import com.flagship.procurement_ledger.ledger.LedgerRequest;

import java.util.List;
import java.util.Optional;

/**
 * State of a cancellation flow: the pending requests that were offered.
 *
 * Only row positions from this list may be cancelled, which keeps a user from
 * cancelling rows that belong to someone else.
 */
public class CancellationSelection implements FlowState {

    private final List<LedgerRequest> offered;

    public CancellationSelection(List<LedgerRequest> offered) {
        if (offered.isEmpty()) {
            throw new IllegalArgumentException("Nothing to select from");
        }
        this.offered = List.copyOf(offered);
    }

    @Override
    public FlowKind kind() {
        return FlowKind.CANCELLATION;
    }

    public List<LedgerRequest> offered() {
        return offered;
    }

    public Optional<LedgerRequest> find(int rowPosition) {
        return offered.stream()
                .filter(request -> request.getRowPosition() == rowPosition)
                .findFirst();
    }
}
