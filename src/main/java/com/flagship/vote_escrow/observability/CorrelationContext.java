package com.flagship.vote_escrow.observability;

import java.util.UUID;

/**
 * Thread-local correlation ID plus the MDC keys used across the service.
 *
 * The correlation ID comes from the X-Correlation-ID request header or is
 * generated, and is attached to every log line of the request via MDC.
 * Lock operations add the position id and the caller id while they run.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String POSITION_ID_MDC_KEY = "positionId";
    public static final String CALLER_ID_MDC_KEY = "callerId";

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

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short random ID, readable in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
