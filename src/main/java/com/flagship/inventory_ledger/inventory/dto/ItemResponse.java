package com.flagship.inventory_ledger.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.inventory.Item;
import com.flagship.inventory_ledger.inventory.ItemType;
import com.flagship.inventory_ledger.inventory.UnitType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class ItemResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    @JsonProperty("item_type")
    ItemType itemType;

    @JsonProperty("unit_type")
    UnitType unitType;

    @JsonProperty("total_quantity")
    int totalQuantity;

    @JsonProperty("avg_price")
    BigDecimal avgPrice;

    @JsonProperty("standard_cost")
    BigDecimal standardCost;

    @JsonProperty("unit_cost")
    BigDecimal unitCost;

    @JsonProperty("stock_value")
    BigDecimal stockValue;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ItemResponse from(Item item, BigDecimal unitCost) {
        return ItemResponse.builder()
            .id(item.getId())
            .name(item.getName())
            .itemType(item.getItemType())
            .unitType(item.getUnitType())
            .totalQuantity(item.getTotalQuantity())
            .avgPrice(item.getAvgPrice())
            .standardCost(item.getStandardCost())
            .unitCost(unitCost)
            .stockValue(Money.of(unitCost.multiply(BigDecimal.valueOf(item.getTotalQuantity()))))
            .createdAt(item.getCreatedAt())
            .updatedAt(item.getUpdatedAt())
            .build();
    }
}
