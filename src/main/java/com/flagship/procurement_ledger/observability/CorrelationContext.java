package com.flagship.procurement_ledger.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the service.
 *
 * The correlation id comes from the HTTP header or is generated per inbound
 * chat event, and appears in every log line through the MDC.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String IDENTITY_MDC_KEY = "identity";
    public static final String ORDER_NUMBER_MDC_KEY = "orderNumber";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    /**
     * Clears the correlation ID from the current thread.
     */
    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short random id, readable in log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
