package com.flagship.procurement_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the procurement request lifecycle.
 *
 * Metrics exposed:
 * - procurement.requests.submitted: submissions, tagged by cost center and status
 * - procurement.requests.cancelled: cancellations, tagged by status
 * - procurement.ledger.failures: store failures, tagged by ledger operation
 * - procurement.ledger.latency: ledger operation round-trip time
 * - procurement.admin.notifications: admin deliveries, tagged by kind and status
 * - procurement.chat.events: inbound chat events, tagged by type
 * - procurement.input.rejected: typed input refused by a closed-set prompt
 * - procurement.chat.replies.failed: replies the transport did not accept
 */
@Component
public class ProcurementMetrics {

    private final MeterRegistry registry;

    private final Counter duplicateEvents;
    private final Counter replyFailures;

    public ProcurementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.duplicateEvents = Counter.builder("procurement.chat.events.duplicate")
                .description("Inbound chat events skipped because they were already processed")
                .register(registry);

        this.replyFailures = Counter.builder("procurement.chat.replies.failed")
                .description("Replies to requesters that could not be delivered")
                .register(registry);
    }

    public void recordRequestSubmitted(String costCenter, String status) {
        registry.counter("procurement.requests.submitted",
                "cost_center", sanitizeTag(costCenter),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordRequestCancelled(String status) {
        registry.counter("procurement.requests.cancelled",
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordLedgerFailure(String operation) {
        registry.counter("procurement.ledger.failures",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    /**
     * Records ledger operation latency.
     */
    public void recordLedgerLatency(String operation, long durationMs) {
        Timer.builder("procurement.ledger.latency")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordAdminNotification(String kind, boolean delivered) {
        registry.counter("procurement.admin.notifications",
                "kind", sanitizeTag(kind),
                "status", delivered ? "delivered" : "failed"
        ).increment();
    }

    public void recordChatEvent(String eventType) {
        registry.counter("procurement.chat.events",
                "type", sanitizeTag(eventType)
        ).increment();
    }

    public void recordDuplicateEvent() {
        duplicateEvents.increment();
    }

    public void recordReplyFailure() {
        replyFailures.increment();
    }

    public void recordRejectedInput(String stage) {
        registry.counter("procurement.input.rejected",
                "stage", sanitizeTag(stage)
        ).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
