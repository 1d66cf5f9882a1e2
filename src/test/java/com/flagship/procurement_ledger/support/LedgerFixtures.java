package com.flagship.procurement_ledger.support;

import com.flagship.procurement_ledger.ledger.RequestLedger;
import com.flagship.procurement_ledger.observability.ProcurementMetrics;
import com.flagship.procurement_ledger.store.LedgerColumn;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared setup for tests that run the request ledger on the in-memory store.
 */
public final class LedgerFixtures {

    public static final ZoneId ZONE = ZoneId.of("Europe/Berlin");

    // Wednesday; the week started on Monday 2024-05-13
    public static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 15, 10, 30, 0);

    private LedgerFixtures() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW.atZone(ZONE).toInstant(), ZONE);
    }

    public static RequestLedger ledger(InMemoryLedgerStore store, ProcurementMetrics metrics) {
        return new RequestLedger(store, new InMemoryOrderNumberAllocator(store.rowCount() - 1),
                TransactionOperations.withoutTransaction(), fixedClock(), metrics, 10);
    }

    public static ProcurementMetrics metrics() {
        return new ProcurementMetrics(new SimpleMeterRegistry());
    }

    /**
     * Appends a raw data row, bypassing the ledger, as a manual spreadsheet edit would.
     */
    public static int appendRaw(InMemoryLedgerStore store, String orderNumber, String createdAt,
                                String name, String identity, String article, String costCenter,
                                String status) {
        List<String> cells = new ArrayList<>(Collections.nCopies(LedgerColumn.count(), ""));
        cells.set(LedgerColumn.ORDER_NUMBER.index(), orderNumber);
        cells.set(LedgerColumn.CREATED_AT.index(), createdAt);
        cells.set(LedgerColumn.REQUESTER_NAME.index(), name);
        cells.set(LedgerColumn.REQUESTER_IDENTITY.index(), identity);
        cells.set(LedgerColumn.ARTICLE.index(), article);
        cells.set(LedgerColumn.QUANTITY.index(), "1");
        cells.set(LedgerColumn.URGENCY.index(), "Normal");
        cells.set(LedgerColumn.COST_CENTER.index(), costCenter);
        cells.set(LedgerColumn.FULFILLMENT_STATUS.index(), status);
        return store.appendRow(cells);
    }
}
