package com.flagship.inventory_ledger.inventory;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class InventoryValuation {

    @JsonProperty("raw_material_value")
    BigDecimal rawMaterialValue;

    @JsonProperty("final_product_value")
    BigDecimal finalProductValue;

    @JsonProperty("total_value")
    BigDecimal totalValue;

    @JsonProperty("raw_material_count")
    long rawMaterialCount;

    @JsonProperty("final_product_count")
    long finalProductCount;

    @JsonProperty("raw_material_quantity")
    long rawMaterialQuantity;

    @JsonProperty("final_product_quantity")
    long finalProductQuantity;

    @JsonProperty("low_stock_threshold")
    int lowStockThreshold;

    @JsonProperty("low_stock_items")
    List<LowStockItem> lowStockItems;

    @Value
    public static class LowStockItem {

        @JsonProperty("item_id")
        String itemId;

        @JsonProperty("name")
        String name;

        @JsonProperty("item_type")
        ItemType itemType;

        @JsonProperty("total_quantity")
        int totalQuantity;

        static LowStockItem from(Item item) {
            return new LowStockItem(item.getId(), item.getName(), item.getItemType(), item.getTotalQuantity());
        }
    }
}
