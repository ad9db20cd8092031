package com.flagship.inventory_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A lump-sum supplier payment was split across open invoices.
 */
@Value
public class DirectPaymentAppliedEvent implements DomainEvent {
    UUID eventId;
    String directPaymentRef;
    String supplierId;
    BigDecimal amount;
    String method;
    List<String> paymentIds;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DirectPaymentApplied";

    public static DirectPaymentAppliedEvent of(String directPaymentRef, String supplierId, BigDecimal amount,
                                               String method, List<String> paymentIds) {
        return new DirectPaymentAppliedEvent(UUID.randomUUID(), directPaymentRef, supplierId, amount, method,
                List.copyOf(paymentIds), Instant.now());
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return supplierId;
    }

    @Override
    public AggregateType getAggregateType() {
        return AggregateType.PAYMENT;
    }
}
