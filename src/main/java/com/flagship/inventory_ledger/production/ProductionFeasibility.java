package com.flagship.inventory_ledger.production;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class ProductionFeasibility {

    @JsonProperty("final_product_id")
    String finalProductId;

    @JsonProperty("feasible")
    boolean feasible;

    @JsonProperty("requested_quantity")
    int requestedQuantity;

    @JsonProperty("max_producible_quantity")
    int maxProducibleQuantity;

    @JsonProperty("insufficient_items")
    List<InsufficientItem> insufficientItems;

    @JsonProperty("message")
    String message;

    @Value
    public static class InsufficientItem {

        @JsonProperty("raw_item_id")
        String rawItemId;

        @JsonProperty("raw_item_name")
        String rawItemName;

        @JsonProperty("required_quantity")
        BigDecimal requiredQuantity;

        @JsonProperty("available_quantity")
        int availableQuantity;

        @JsonProperty("shortfall")
        BigDecimal shortfall;
    }
}
