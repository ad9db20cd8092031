package com.flagship.inventory_ledger.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.inventory.ItemType;
import com.flagship.inventory_ledger.inventory.UnitType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CreateItemRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Item type is required")
    @JsonProperty("item_type")
    ItemType itemType;

    @JsonProperty("unit_type")
    UnitType unitType;
}
