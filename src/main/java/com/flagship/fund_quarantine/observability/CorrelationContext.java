package com.flagship.fund_quarantine.observability;

import java.util.UUID;

/**
 * Thread-local correlation id for the current request.
 *
 * The id is taken from the {@code X-Correlation-ID} header (or generated),
 * put into the MDC for every log line, stamped onto audit records and
 * forwarded as a Kafka header by the outbox publisher.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String QUARANTINE_ID_MDC_KEY = "quarantineId";
    public static final String BUDGET_LINE_ID_MDC_KEY = "budgetLineId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
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

    /**
     * Returns the correlation ID bound to this thread, or null outside a request.
     */
    public static String currentOrNull() {
        return correlationId.get();
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form keeps log lines readable.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
