package com.flagship.inventory_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A payment was applied to, or removed from, a purchase invoice.
 */
@Value
public class PaymentAppliedEvent implements DomainEvent {
    UUID eventId;
    String paymentId;
    String invoiceId;
    String supplierId;
    BigDecimal amount;
    BigDecimal invoiceBalanceDue;
    String invoiceStatus;
    String directPaymentRef;
    boolean reversal;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentApplied";
    public static final String REVERSED_EVENT_TYPE = "PaymentReversed";

    public static PaymentAppliedEvent applied(String paymentId, String invoiceId, String supplierId,
                                              BigDecimal amount, BigDecimal balanceDue, String status,
                                              String directPaymentRef) {
        return new PaymentAppliedEvent(UUID.randomUUID(), paymentId, invoiceId, supplierId, amount,
                balanceDue, status, directPaymentRef, false, Instant.now());
    }

    public static PaymentAppliedEvent reversed(String paymentId, String invoiceId, String supplierId,
                                               BigDecimal amount, BigDecimal balanceDue, String status,
                                               String directPaymentRef) {
        return new PaymentAppliedEvent(UUID.randomUUID(), paymentId, invoiceId, supplierId, amount,
                balanceDue, status, directPaymentRef, true, Instant.now());
    }

    @Override
    public String getEventType() {
        return reversal ? REVERSED_EVENT_TYPE : EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return invoiceId;
    }

    @Override
    public AggregateType getAggregateType() {
        return AggregateType.PAYMENT;
    }
}
