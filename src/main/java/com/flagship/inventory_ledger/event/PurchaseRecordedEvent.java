package com.flagship.inventory_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A purchase invoice was created, or its lines were replaced.
 */
@Value
public class PurchaseRecordedEvent implements DomainEvent {
    UUID eventId;
    String invoiceId;
    String supplierId;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    String paymentStatus;
    int lineCount;
    boolean update;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PurchaseRecorded";

    public static PurchaseRecordedEvent of(String invoiceId, String supplierId, BigDecimal totalAmount,
                                           BigDecimal paidAmount, String paymentStatus, int lineCount,
                                           boolean update) {
        return new PurchaseRecordedEvent(UUID.randomUUID(), invoiceId, supplierId, totalAmount, paidAmount,
                paymentStatus, lineCount, update, Instant.now());
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return invoiceId;
    }

    @Override
    public AggregateType getAggregateType() {
        return AggregateType.PURCHASE_INVOICE;
    }
}
