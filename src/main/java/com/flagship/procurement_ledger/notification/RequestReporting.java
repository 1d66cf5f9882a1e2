package com.flagship.procurement_ledger.notification;

import com.flagship.procurement_ledger.chat.ChatGateway;
import com.flagship.procurement_ledger.chat.SendText;
import com.flagship.procurement_ledger.ledger.LedgerOutcome;
import com.flagship.procurement_ledger.ledger.LedgerRequest;
import com.flagship.procurement_ledger.ledger.RequestLedger;
import com.flagship.procurement_ledger.ledger.WeeklySummary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Answers the read-only commands: own pending requests, search and weekly statistics.
 */
@Service
@RequiredArgsConstructor
public class RequestReporting {

    private final RequestLedger ledger;
    private final ChatGateway gateway;
    private final MessageFormatter formatter;

    public void showPending(String identity) {
        LedgerOutcome<List<LedgerRequest>> outcome = ledger.listPending(identity);
        if (!outcome.isAvailable()) {
            reply(identity, formatter.ledgerUnavailable());
        } else if (outcome.getValue().isEmpty()) {
            reply(identity, formatter.noPending());
        } else {
            reply(identity, formatter.pendingList(outcome.getValue()));
        }
    }

    public void search(String identity, String term) {
        if (term == null || term.isBlank()) {
            reply(identity, formatter.searchUsage());
            return;
        }

        LedgerOutcome<List<LedgerRequest>> outcome = ledger.search(term);
        if (!outcome.isAvailable()) {
            reply(identity, formatter.ledgerUnavailable());
        } else if (outcome.getValue().isEmpty()) {
            reply(identity, formatter.searchNoResults(term));
        } else {
            reply(identity, formatter.searchResults(term, outcome.getValue()));
        }
    }

    public void showStatistics(String identity) {
        LedgerOutcome<WeeklySummary> outcome = ledger.weeklyAggregate();
        if (!outcome.isAvailable()) {
            reply(identity, formatter.statisticsUnavailable());
            return;
        }
        reply(identity, formatter.statistics(outcome.getValue()));
    }

    private void reply(String identity, String text) {
        gateway.send(SendText.of(identity, text));
    }
}
