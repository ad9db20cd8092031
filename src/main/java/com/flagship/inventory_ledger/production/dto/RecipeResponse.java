package com.flagship.inventory_ledger.production.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.production.Recipe;
import com.flagship.inventory_ledger.production.RecipeLine;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class RecipeResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("final_product_id")
    String finalProductId;

    @JsonProperty("name")
    String name;

    @JsonProperty("items")
    List<Line> items;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static RecipeResponse from(Recipe recipe) {
        return RecipeResponse.builder()
            .id(recipe.getId())
            .finalProductId(recipe.getFinalProductId())
            .name(recipe.getName())
            .items(recipe.getLines().stream().map(Line::from).toList())
            .createdAt(recipe.getCreatedAt())
            .updatedAt(recipe.getUpdatedAt())
            .build();
    }

    @Value
    public static class Line {

        @JsonProperty("raw_item_id")
        String rawItemId;

        @JsonProperty("quantity_per_unit")
        BigDecimal quantityPerUnit;

        static Line from(RecipeLine line) {
            return new Line(line.getRawItemId(), line.getQuantityPerUnit());
        }
    }
}
