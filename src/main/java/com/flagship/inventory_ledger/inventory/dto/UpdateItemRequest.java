package com.flagship.inventory_ledger.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.inventory.UnitType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Only descriptive fields can change. Stock aggregates move through purchases,
 * production and adjustments.
 */
@Value
@Builder
@Jacksonized
public class UpdateItemRequest {

    @JsonProperty("name")
    String name;

    @JsonProperty("unit_type")
    UnitType unitType;
}
