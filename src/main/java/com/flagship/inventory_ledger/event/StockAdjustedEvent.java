package com.flagship.inventory_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class StockAdjustedEvent implements DomainEvent {
    UUID eventId;
    String adjustmentId;
    String itemId;
    int quantityDelta;
    int quantityAfter;
    BigDecimal avgPriceAfter;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "StockAdjusted";

    public static StockAdjustedEvent of(String adjustmentId, String itemId, int quantityDelta, int quantityAfter,
                                        BigDecimal avgPriceAfter, String reason) {
        return new StockAdjustedEvent(UUID.randomUUID(), adjustmentId, itemId, quantityDelta, quantityAfter,
                avgPriceAfter, reason, Instant.now());
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return itemId;
    }

    @Override
    public AggregateType getAggregateType() {
        return AggregateType.ITEM;
    }
}
