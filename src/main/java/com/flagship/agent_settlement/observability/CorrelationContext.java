package com.flagship.agent_settlement.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys settlement code logs under.
 *
 * The id comes from the {@code X-Correlation-ID} header or is generated,
 * and is echoed back on the response.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String EXCHANGE_ID_MDC_KEY = "exchangeId";
    public static final String WAGER_ID_MDC_KEY = "wagerId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
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
