package com.flagship.inventory_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact recorded by the engine and published through the outbox.
 */
public interface DomainEvent {

    /**
     * Unique id of this event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    /**
     * Id of the invoice, payment, batch or item the event is about.
     */
    @JsonIgnore
    String getAggregateId();

    @JsonIgnore
    AggregateType getAggregateType();

    Instant getOccurredAt();

    String getEventType();
}
