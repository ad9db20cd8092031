package com.flagship.inventory_ledger.production.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.production.ProductionBatch;
import com.flagship.inventory_ledger.production.ProductionStage;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class BatchResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("final_product_id")
    String finalProductId;

    @JsonProperty("quantity_produced")
    int quantityProduced;

    @JsonProperty("stage")
    ProductionStage stage;

    @JsonProperty("serial_numbers")
    List<String> serialNumbers;

    @JsonProperty("recipe_items")
    List<RecipeResponse.Line> recipeItems;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static BatchResponse from(ProductionBatch batch) {
        return BatchResponse.builder()
            .id(batch.getId())
            .finalProductId(batch.getFinalProductId())
            .quantityProduced(batch.getQuantityProduced())
            .stage(batch.getStage())
            .serialNumbers(batch.getSerialNumbers())
            .recipeItems(batch.getRecipeLines().stream()
                    .map(line -> new RecipeResponse.Line(line.getRawItemId(), line.getQuantityPerUnit()))
                    .toList())
            .createdAt(batch.getCreatedAt())
            .updatedAt(batch.getUpdatedAt())
            .build();
    }
}
