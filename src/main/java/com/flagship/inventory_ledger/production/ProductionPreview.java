package com.flagship.inventory_ledger.production;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Raw material requirements and estimated cost for producing a quantity of
 * a final product from its master recipe. Nothing is reserved.
 */
@Value
public class ProductionPreview {

    @JsonProperty("final_product_id")
    String finalProductId;

    @JsonProperty("final_product_name")
    String finalProductName;

    @JsonProperty("quantity")
    int quantity;

    @JsonProperty("raw_requirements")
    List<RawRequirement> rawRequirements;

    @JsonProperty("total_estimated_cost")
    BigDecimal totalEstimatedCost;

    @JsonProperty("all_sufficient")
    public boolean isAllSufficient() {
        return rawRequirements.stream().allMatch(RawRequirement::isSufficient);
    }

    @Value
    public static class RawRequirement {

        @JsonProperty("raw_item_id")
        String rawItemId;

        @JsonProperty("raw_item_name")
        String rawItemName;

        @JsonProperty("quantity_per_unit")
        BigDecimal quantityPerUnit;

        @JsonProperty("quantity_required")
        BigDecimal quantityRequired;

        @JsonProperty("avg_price")
        BigDecimal avgPrice;

        @JsonProperty("available_quantity")
        int availableQuantity;

        @JsonProperty("sufficient")
        boolean sufficient;
    }
}
