package com.flagship.inventory_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys the engine logs under.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String INVOICE_ID_MDC_KEY = "invoiceId";
    public static final String BATCH_ID_MDC_KEY = "batchId";
    public static final String SUPPLIER_ID_MDC_KEY = "supplierId";

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
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(INVOICE_ID_MDC_KEY);
        MDC.remove(BATCH_ID_MDC_KEY);
        MDC.remove(SUPPLIER_ID_MDC_KEY);
    }

    /**
     * Short random id, readable in log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts a key on the MDC and returns a handle that removes it again,
     * for use in try-with-resources around a single engine operation.
     */
    public static MDC.MDCCloseable scope(String key, String value) {
        return MDC.putCloseable(key, value);
    }
}
