package com.flagship.inventory_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PurchaseDeletedEvent implements DomainEvent {
    UUID eventId;
    String invoiceId;
    String supplierId;
    BigDecimal totalAmount;
    int paymentsReversed;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PurchaseDeleted";

    public static PurchaseDeletedEvent of(String invoiceId, String supplierId, BigDecimal totalAmount,
                                          int paymentsReversed) {
        return new PurchaseDeletedEvent(UUID.randomUUID(), invoiceId, supplierId, totalAmount,
                paymentsReversed, Instant.now());
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
