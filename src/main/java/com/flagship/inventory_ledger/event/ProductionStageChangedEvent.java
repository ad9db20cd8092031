package com.flagship.inventory_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A production batch was drafted, moved to another stage, or deleted.
 * {@code fromStage} is null for a new draft and {@code toStage} is null for a deletion.
 */
@Value
public class ProductionStageChangedEvent implements DomainEvent {
    UUID eventId;
    String batchId;
    String finalProductId;
    int quantity;
    String fromStage;
    String toStage;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ProductionStageChanged";

    public static ProductionStageChangedEvent of(String batchId, String finalProductId, int quantity,
                                                 String fromStage, String toStage) {
        return new ProductionStageChangedEvent(UUID.randomUUID(), batchId, finalProductId, quantity,
                fromStage, toStage, Instant.now());
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return batchId;
    }

    @Override
    public AggregateType getAggregateType() {
        return AggregateType.PRODUCTION_BATCH;
    }
}
