package com.flagship.procurement_ledger.ledger;

import com.flagship.procurement_ledger.observability.ProcurementMetrics;
import com.flagship.procurement_ledger.store.LedgerColumn;
import com.flagship.procurement_ledger.support.InMemoryLedgerStore;
import com.flagship.procurement_ledger.support.LedgerFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static com.flagship.procurement_ledger.support.LedgerFixtures.appendRaw;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Request ledger rules on top of an in-memory store:
 * - order numbers are sequential and assigned once
 * - pending lists are scoped to one identity
 * - cancellation is a status change, never a removal
 * - store failures surface as "unavailable", never as exceptions
 */
class RequestLedgerTest {

    private InMemoryLedgerStore store;
    private SimpleMeterRegistry registry;
    private ProcurementMetrics metrics;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
        registry = new SimpleMeterRegistry();
        metrics = new ProcurementMetrics(registry);
    }

    private RequestLedger ledger() {
        return LedgerFixtures.ledger(store, metrics);
    }

    private static NewRequest request(String identity, String article) {
        return NewRequest.builder()
                .requesterName("Max Muster")
                .requesterIdentity(identity)
                .article(article)
                .quantity("2")
                .urgency(Urgency.NORMAL)
                .costCenter("Lager")
                .build();
    }

    @Test
    @DisplayName("Sequential appends are numbered #001, #002, #003")
    void testSequentialNumbering() {
        RequestLedger ledger = ledger();

        for (int i = 1; i <= 3; i++) {
            LedgerOutcome<OrderNumber> outcome = ledger.append(request("U1", "Article " + i));
            assertTrue(outcome.isAvailable());
            assertEquals(String.format("#%03d", i), outcome.getValue().format());
        }

        assertEquals(4, store.rowCount());
        assertEquals("#003", store.cell(4, LedgerColumn.ORDER_NUMBER));
    }

    @Test
    @DisplayName("Submitting Toner writes one pending row numbered after the existing rows")
    void testTonerScenario() {
        appendRaw(store, "#001", "2024-05-01 08:00:00", "A", "U9", "Paper", "HR", "");
        appendRaw(store, "#002", "2024-05-02 08:00:00", "A", "U9", "Pens", "HR", "");
        int rowCountBefore = store.rowCount();
        RequestLedger ledger = ledger();

        LedgerOutcome<OrderNumber> outcome = ledger.append(NewRequest.builder()
                .requesterName("Max")
                .requesterIdentity("U1")
                .article("Toner")
                .quantity("2")
                .urgency(Urgency.NORMAL)
                .costCenter("Lager")
                .build());

        assertTrue(outcome.isAvailable());
        assertEquals(String.format("#%03d", rowCountBefore), outcome.getValue().format());
        assertEquals(rowCountBefore + 1, store.rowCount());

        int position = store.rowCount();
        assertEquals("Toner", store.cell(position, LedgerColumn.ARTICLE));
        assertEquals("2", store.cell(position, LedgerColumn.QUANTITY));
        assertEquals("Normal", store.cell(position, LedgerColumn.URGENCY));
        assertEquals("Lager", store.cell(position, LedgerColumn.COST_CENTER));
        assertEquals("", store.cell(position, LedgerColumn.FULFILLMENT_STATUS));
        assertEquals("", store.cell(position, LedgerColumn.FULFILLED_AT));
        assertEquals("", store.cell(position, LedgerColumn.ATTACHMENT_REFERENCE));
        assertEquals("2024-05-15 10:30:00", store.cell(position, LedgerColumn.CREATED_AT));
    }

    @Test
    @DisplayName("Attachment reference is stored in the trailing column")
    void testAttachmentStored() {
        RequestLedger ledger = ledger();

        NewRequest withPhoto = NewRequest.builder()
                .requesterName("Max")
                .requesterIdentity("U1")
                .article("Drill")
                .quantity("1")
                .urgency(Urgency.URGENT)
                .costCenter("Stahlhalle")
                .attachmentReference("photo-123")
                .build();
        ledger.append(withPhoto);

        assertEquals("photo-123", store.cell(2, LedgerColumn.ATTACHMENT_REFERENCE));
        assertEquals("Urgent", store.cell(2, LedgerColumn.URGENCY));
    }

    @Test
    @DisplayName("listPending returns only the identity's pending rows in ledger order")
    void testListPendingScopedToIdentity() {
        RequestLedger ledger = ledger();
        ledger.append(request("U1", "Toner"));
        ledger.append(request("U2", "Gloves"));
        ledger.append(request("U1", "Paper"));
        appendRaw(store, "#004", "2024-05-14 09:00:00", "Max", "U1", "Screws", "Lager", "bestellt");

        LedgerOutcome<List<LedgerRequest>> outcome = ledger.listPending("U1");

        assertTrue(outcome.isAvailable());
        List<LedgerRequest> pending = outcome.getValue();
        assertEquals(2, pending.size());
        assertEquals("Toner", pending.get(0).getArticle());
        assertEquals("Paper", pending.get(1).getArticle());
        assertEquals(2, pending.get(0).getRowPosition());
        assertEquals(4, pending.get(1).getRowPosition());
        assertTrue(pending.stream().allMatch(r -> r.getRequesterIdentity().equals("U1")));
        assertTrue(pending.stream().allMatch(r -> r.getFulfillmentStatus().isEmpty()));
    }

    @Test
    @DisplayName("Identity matching is exact, not a prefix match")
    void testListPendingExactIdentity() {
        RequestLedger ledger = ledger();
        ledger.append(request("12", "Toner"));
        ledger.append(request("123", "Paper"));

        List<LedgerRequest> pending = ledger.listPending("12").getValue();

        assertEquals(1, pending.size());
        assertEquals("Toner", pending.get(0).getArticle());
    }

    @Test
    @DisplayName("A cancelled row leaves listPending but is still found by search")
    void testCancelKeepsRow() {
        RequestLedger ledger = ledger();
        ledger.append(request("U1", "Toner"));
        LedgerRequest toner = ledger.listPending("U1").getValue().get(0);

        assertTrue(ledger.cancel(toner.getRowPosition()));

        assertEquals(FulfillmentState.CANCELLED_STATUS, store.cell(toner.getRowPosition(), LedgerColumn.FULFILLMENT_STATUS));
        assertEquals("2024-05-15 10:30", store.cell(toner.getRowPosition(), LedgerColumn.FULFILLED_AT));
        assertTrue(ledger.listPending("U1").getValue().isEmpty());

        List<LedgerRequest> found = ledger.search("toner").getValue();
        assertEquals(1, found.size());
        assertEquals(FulfillmentState.CANCELLED, found.get(0).state());
        assertEquals(2, store.rowCount());
    }

    @Test
    @DisplayName("Cancelling twice keeps the row cancelled")
    void testCancelTwice() {
        RequestLedger ledger = ledger();
        ledger.append(request("U1", "Toner"));

        assertTrue(ledger.cancel(2));
        assertTrue(ledger.cancel(2));

        assertEquals(FulfillmentState.CANCELLED_STATUS, store.cell(2, LedgerColumn.FULFILLMENT_STATUS));
        assertEquals(2.0, registry.get("procurement.requests.cancelled").tag("status", "success").counter().count());
    }

    @Test
    @DisplayName("Cancelling a row that does not exist reports failure")
    void testCancelMissingRow() {
        RequestLedger ledger = ledger();

        assertFalse(ledger.cancel(42));
        assertFalse(ledger.cancel(1));
    }

    @Test
    @DisplayName("Search is case-insensitive over article, requester name and cost center")
    void testSearchFields() {
        appendRaw(store, "#001", "2024-05-13 08:00:00", "Anna Schmidt", "U1", "Printer paper", "HR", "");
        appendRaw(store, "#002", "2024-05-13 09:00:00", "Max", "U2", "Toner", "Finanzen", "");
        appendRaw(store, "#003", "2024-05-13 10:00:00", "Paul", "U3", "Gloves", "Produktion", "");
        RequestLedger ledger = ledger();

        assertEquals("#001", ledger.search("PAPER").getValue().get(0).getOrderNumber());
        assertEquals("#001", ledger.search("schmidt").getValue().get(0).getOrderNumber());
        assertEquals("#002", ledger.search("finanz").getValue().get(0).getOrderNumber());
        assertTrue(ledger.search("drill").getValue().isEmpty());
    }

    @Test
    @DisplayName("Search returns at most ten matches, the first ones in ledger order")
    void testSearchLimit() {
        for (int i = 1; i <= 12; i++) {
            appendRaw(store, String.format("#%03d", i), "2024-05-13 08:00:00", "Max", "U1", "Cable " + i, "Lager", "");
        }
        RequestLedger ledger = ledger();

        List<LedgerRequest> results = ledger.search("cable").getValue();

        assertEquals(10, results.size());
        for (int i = 0; i < 10; i++) {
            assertEquals("Cable " + (i + 1), results.get(i).getArticle());
        }
    }

    @Test
    @DisplayName("Header row never appears in query results")
    void testHeaderExcluded() {
        RequestLedger ledger = ledger();

        assertTrue(ledger.search("article").getValue().isEmpty());
        assertTrue(ledger.listPending("Chat Id").getValue().isEmpty());
    }

    @Test
    @DisplayName("Weekly aggregate counts 3 pending, 1 cancelled, 2 fulfilled")
    void testWeeklyAggregate() {
        appendRaw(store, "#001", "2024-05-13 00:00:00", "A", "U1", "a", "Lager", "");
        appendRaw(store, "#002", "2024-05-13 08:15:00", "A", "U1", "b", "Lager", "");
        appendRaw(store, "#003", "2024-05-14 11:00:00", "A", "U2", "c", "HR", "");
        appendRaw(store, "#004", "2024-05-14 12:00:00", "A", "U2", "d", "HR", "CANCELLED");
        appendRaw(store, "#005", "2024-05-15 09:00:00", "A", "U3", "e", "Bulli", "ja");
        appendRaw(store, "#006", "2024-05-15 10:30:00", "A", "U3", "f", "Lager", "bestellt");
        // Outside the window or unreadable
        appendRaw(store, "#007", "2024-05-12 23:59:59", "A", "U3", "g", "Lager", "");
        appendRaw(store, "#008", "2024-05-15 10:30:01", "A", "U3", "h", "Lager", "");
        appendRaw(store, "#009", "yesterday", "A", "U3", "i", "Lager", "");
        RequestLedger ledger = ledger();

        LedgerOutcome<WeeklySummary> outcome = ledger.weeklyAggregate(LedgerFixtures.NOW);

        assertTrue(outcome.isAvailable());
        WeeklySummary summary = outcome.getValue();
        assertEquals(6, summary.getTotal());
        assertEquals(3, summary.getPending());
        assertEquals(1, summary.getCancelled());
        assertEquals(2, summary.getFulfilled());
        assertEquals(summary.getTotal(), summary.getPending() + summary.getFulfilled() + summary.getCancelled());
        assertEquals(Map.of("Lager", 3, "HR", 2, "Bulli", 1), summary.getByCostCenter());
        assertEquals(LocalDateTime.of(2024, 5, 13, 0, 0), summary.getWindowStart());
    }

    @Test
    @DisplayName("On a Monday the window starts at midnight of the same day")
    void testWeeklyAggregateOnMonday() {
        appendRaw(store, "#001", "2024-05-12 18:00:00", "A", "U1", "a", "Lager", "");
        appendRaw(store, "#002", "2024-05-13 07:00:00", "A", "U1", "b", "Lager", "");
        RequestLedger ledger = ledger();

        WeeklySummary summary = ledger.weeklyAggregate(LocalDateTime.of(2024, 5, 13, 9, 0)).getValue();

        assertEquals(1, summary.getTotal());
        assertEquals(LocalDateTime.of(2024, 5, 13, 0, 0), summary.getWindowStart());
    }

    @Test
    @DisplayName("Legacy STORNIERT status counts as cancelled")
    void testLegacyCancelledStatus() {
        appendRaw(store, "#001", "2024-05-14 07:00:00", "A", "U1", "a", "Lager", "STORNIERT");
        RequestLedger ledger = ledger();

        WeeklySummary summary = ledger.weeklyAggregate(LedgerFixtures.NOW).getValue();

        assertEquals(1, summary.getCancelled());
        assertEquals(0, summary.getFulfilled());
        assertTrue(ledger.listPending("U1").getValue().isEmpty());
    }

    @Test
    @DisplayName("Store failures are reported as unavailable and counted")
    void testStoreFailure() {
        RequestLedger ledger = ledger();
        ledger.append(request("U1", "Toner"));
        store.setFailing(true);

        assertFalse(ledger.append(request("U1", "Paper")).isAvailable());
        assertFalse(ledger.listPending("U1").isAvailable());
        assertFalse(ledger.search("toner").isAvailable());
        assertFalse(ledger.weeklyAggregate().isAvailable());
        assertFalse(ledger.cancel(2));

        assertEquals(1.0, registry.get("procurement.ledger.failures").tag("operation", "append").counter().count());
        assertEquals(1.0, registry.get("procurement.ledger.failures").tag("operation", "cancel").counter().count());

        store.setFailing(false);
        assertEquals(2, store.rowCount());
    }
}
