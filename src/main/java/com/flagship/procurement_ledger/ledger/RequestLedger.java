package com.flagship.procurement_ledger.ledger;

import com.flagship.procurement_ledger.observability.ProcurementMetrics;
import com.flagship.procurement_ledger.store.LedgerColumn;
import com.flagship.procurement_ledger.store.LedgerRow;
import com.flagship.procurement_ledger.store.LedgerStore;
import com.flagship.procurement_ledger.store.LedgerStoreException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Domain operations over the request ledger.
 *
 * This service enforces the ledger rules:
 * 1. An order number is reserved and the row appended in one transaction, so a number
 *    is assigned exactly once and only to a row that was durably written
 * 2. Rows are never deleted; cancellation only rewrites the two fulfillment cells
 * 3. Store failures never escape: they are logged, counted and reported as an
 *    unavailable outcome (or {@code false} for cancel)
 *
 * Ownership is not re-checked by {@link #cancel(int)}. Callers must only pass row
 * positions they obtained from {@link #listPending(String)} for the acting identity.
 */
@Service
@Slf4j
public class RequestLedger {

    private final LedgerStore store;
    private final OrderNumberAllocator allocator;
    private final TransactionOperations transactions;
    private final Clock clock;
    private final ProcurementMetrics metrics;
    private final int searchLimit;

    public RequestLedger(LedgerStore store,
                         OrderNumberAllocator allocator,
                         TransactionOperations transactions,
                         Clock clock,
                         ProcurementMetrics metrics,
                         @Value("${procurement.search.max-results:10}") int searchLimit) {
        if (searchLimit <= 0) {
            throw new IllegalArgumentException("Search limit must be positive");
        }
        this.store = store;
        this.allocator = allocator;
        this.transactions = transactions;
        this.clock = clock;
        this.metrics = metrics;
        this.searchLimit = searchLimit;
    }

    /**
     * Appends a new request.
     *
     * @param request collected request fields
     * @return the assigned order number, or unavailable if nothing was written
     */
    public LedgerOutcome<OrderNumber> append(NewRequest request) {
        long startTime = System.currentTimeMillis();
        LocalDateTime createdAt = LocalDateTime.now(clock);

        try {
            OrderNumber orderNumber = transactions.execute(status -> {
                OrderNumber reserved = OrderNumber.of(allocator.reserveNext());
                store.appendRow(request.toCells(reserved, createdAt));
                return reserved;
            });

            MDC.put("orderNumber", orderNumber.format());
            log.info("Saved request {} from {}: article={}, costCenter={}",
                    orderNumber, request.getRequesterName(), request.getArticle(), request.getCostCenter());
            metrics.recordRequestSubmitted(request.getCostCenter(), "success");
            return LedgerOutcome.ok(orderNumber);

        } catch (LedgerStoreException | TransactionException e) {
            log.error("Saving request from {} failed: {}", request.getRequesterIdentity(), e.getMessage());
            metrics.recordLedgerFailure("append");
            metrics.recordRequestSubmitted(request.getCostCenter(), "error");
            return LedgerOutcome.unavailable();
        } finally {
            metrics.recordLedgerLatency("append", System.currentTimeMillis() - startTime);
            MDC.remove("orderNumber");
        }
    }

    /**
     * Lists the pending requests of one identity, in ledger order.
     */
    public LedgerOutcome<List<LedgerRequest>> listPending(String identity) {
        Optional<List<LedgerRequest>> requests = readRequests("list_pending");
        if (requests.isEmpty()) {
            return LedgerOutcome.unavailable();
        }

        List<LedgerRequest> pending = requests.get().stream()
            .filter(request -> request.getRequesterIdentity().equals(identity))
            .filter(LedgerRequest::isPending)
            .toList();

        log.debug("Found {} pending requests for identity {}", pending.size(), identity);
        return LedgerOutcome.ok(pending);
    }

    /**
     * Marks the request at the given row as cancelled and stamps the time.
     * Cancelling an already cancelled row overwrites the timestamp.
     *
     * @return true if both cells were written
     */
    public boolean cancel(int rowPosition) {
        long startTime = System.currentTimeMillis();
        String cancelledAt = LedgerTimestamps.formatFulfilledAt(LocalDateTime.now(clock));

        try {
            transactions.executeWithoutResult(status -> {
                store.updateCell(rowPosition, LedgerColumn.FULFILLMENT_STATUS, FulfillmentState.CANCELLED_STATUS);
                store.updateCell(rowPosition, LedgerColumn.FULFILLED_AT, cancelledAt);
            });
            log.info("Cancelled request at row {}", rowPosition);
            metrics.recordRequestCancelled("success");
            return true;

        } catch (LedgerStoreException | TransactionException | IllegalArgumentException e) {
            log.error("Cancelling request at row {} failed: {}", rowPosition, e.getMessage());
            metrics.recordLedgerFailure("cancel");
            metrics.recordRequestCancelled("error");
            return false;
        } finally {
            metrics.recordLedgerLatency("cancel", System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Case-insensitive substring search over article, requester name and cost center.
     * Returns the first matches in ledger order, not ranked.
     */
    public LedgerOutcome<List<LedgerRequest>> search(String term) {
        Optional<List<LedgerRequest>> requests = readRequests("search");
        if (requests.isEmpty()) {
            return LedgerOutcome.unavailable();
        }

        String needle = term == null ? "" : term.toLowerCase(Locale.ROOT);
        List<LedgerRequest> matches = requests.get().stream()
            .filter(request -> contains(request.getArticle(), needle)
                || contains(request.getRequesterName(), needle)
                || contains(request.getCostCenter(), needle))
            .limit(searchLimit)
            .toList();

        return LedgerOutcome.ok(matches);
    }

    /**
     * Aggregates the current week as of the ledger clock.
     */
    public LedgerOutcome<WeeklySummary> weeklyAggregate() {
        return weeklyAggregate(LocalDateTime.now(clock));
    }

    /**
     * Aggregates requests created between the most recent Monday 00:00 and {@code now},
     * both inclusive. Rows whose creation time cannot be parsed are left out.
     */
    public LedgerOutcome<WeeklySummary> weeklyAggregate(LocalDateTime now) {
        Optional<List<LedgerRequest>> requests = readRequests("weekly_aggregate");
        if (requests.isEmpty()) {
            return LedgerOutcome.unavailable();
        }

        LocalDateTime windowStart = now.toLocalDate()
            .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
            .atStartOfDay();

        int total = 0;
        int pending = 0;
        int fulfilled = 0;
        int cancelled = 0;
        Map<String, Integer> byCostCenter = new LinkedHashMap<>();

        for (LedgerRequest request : requests.get()) {
            Optional<LocalDateTime> createdAt = LedgerTimestamps.parseCreatedAt(request.getCreatedAt());
            if (createdAt.isEmpty()) {
                continue;
            }
            LocalDateTime created = createdAt.get();
            if (created.isBefore(windowStart) || created.isAfter(now)) {
                continue;
            }

            total++;
            switch (request.state()) {
                case PENDING -> pending++;
                case CANCELLED -> cancelled++;
                case FULFILLED -> fulfilled++;
            }
            byCostCenter.merge(request.getCostCenter(), 1, Integer::sum);
        }

        return LedgerOutcome.ok(WeeklySummary.builder()
            .windowStart(windowStart)
            .windowEnd(now)
            .total(total)
            .pending(pending)
            .fulfilled(fulfilled)
            .cancelled(cancelled)
            .byCostCenter(byCostCenter)
            .build());
    }

    private Optional<List<LedgerRequest>> readRequests(String operation) {
        long startTime = System.currentTimeMillis();
        try {
            List<LedgerRow> rows = store.readAllRows();
            List<LedgerRequest> requests = new ArrayList<>(Math.max(0, rows.size() - 1));
            for (LedgerRow row : rows) {
                if (!row.isHeader()) {
                    requests.add(LedgerRequest.fromRow(row));
                }
            }
            return Optional.of(requests);
        } catch (LedgerStoreException e) {
            log.error("Reading ledger for {} failed: {}", operation, e.getMessage());
            metrics.recordLedgerFailure(operation);
            return Optional.empty();
        } finally {
            metrics.recordLedgerLatency(operation, System.currentTimeMillis() - startTime);
        }
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
