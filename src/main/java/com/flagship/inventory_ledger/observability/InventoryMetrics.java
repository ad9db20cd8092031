package com.flagship.inventory_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Micrometer meters for the engine.
 *
 * inventory.stock.movements   units moved, tagged by direction
 * inventory.stock.shortfalls  rejected issues and reversals
 * purchase.recorded           invoices created, updated, deleted
 * payment.applied             payments by kind, with amount summary
 * production.transitions      batch stage changes
 * inventory.operation.latency per-operation timer
 */
@Component
public class InventoryMetrics {

    private final MeterRegistry registry;
    private final Counter idempotencyHits;
    private final Counter idempotencyMisses;

    public InventoryMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.idempotencyHits = Counter.builder("idempotency.cache")
                .tag("result", "hit")
                .description("Direct payments answered from an earlier request")
                .register(registry);
        this.idempotencyMisses = Counter.builder("idempotency.cache")
                .tag("result", "miss")
                .description("Direct payments processed for the first time")
                .register(registry);
    }

    public void recordStockMovement(String direction, int quantity) {
        registry.counter("inventory.stock.movements", "direction", sanitizeTag(direction))
                .increment(quantity);
    }

    public void recordShortfall(String operation) {
        registry.counter("inventory.stock.shortfalls", "operation", sanitizeTag(operation)).increment();
    }

    public void recordPurchase(String action, String status) {
        registry.counter("purchase.recorded",
                "action", sanitizeTag(action),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordPayment(String kind, BigDecimal amount) {
        registry.counter("payment.applied", "kind", sanitizeTag(kind)).increment();
        registry.summary("payment.amount", "kind", sanitizeTag(kind)).record(amount.doubleValue());
    }

    public void recordAllocation(String method, int invoiceCount) {
        registry.counter("payment.allocation", "method", sanitizeTag(method)).increment();
        registry.summary("payment.allocation.invoices", "method", sanitizeTag(method)).record(invoiceCount);
    }

    public void recordStageTransition(String from, String to) {
        registry.counter("production.transitions",
                "from", sanitizeTag(from),
                "to", sanitizeTag(to)
        ).increment();
    }

    public void recordOperationLatency(String operation, String outcome, long durationMs) {
        registry.timer("inventory.operation.latency",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        idempotencyHits.increment();
    }

    public void recordIdempotencyMiss() {
        idempotencyMisses.increment();
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "none";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
