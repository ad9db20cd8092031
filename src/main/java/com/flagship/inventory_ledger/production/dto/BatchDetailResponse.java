package com.flagship.inventory_ledger.production.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.production.BatchDetail;
import com.flagship.inventory_ledger.production.ProductionBatch;
import com.flagship.inventory_ledger.production.ProductionStage;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class BatchDetailResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("final_product_id")
    String finalProductId;

    @JsonProperty("final_product_name")
    String finalProductName;

    @JsonProperty("quantity_produced")
    int quantityProduced;

    @JsonProperty("stage")
    ProductionStage stage;

    @JsonProperty("serial_numbers")
    List<String> serialNumbers;

    @JsonProperty("recipe_items")
    List<Line> recipeItems;

    @JsonProperty("total_estimated_cost")
    BigDecimal totalEstimatedCost;

    @JsonProperty("cost_per_unit")
    BigDecimal costPerUnit;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static BatchDetailResponse from(BatchDetail detail) {
        ProductionBatch batch = detail.getBatch();
        return BatchDetailResponse.builder()
            .id(batch.getId())
            .finalProductId(batch.getFinalProductId())
            .finalProductName(detail.getFinalProductName())
            .quantityProduced(batch.getQuantityProduced())
            .stage(batch.getStage())
            .serialNumbers(batch.getSerialNumbers())
            .recipeItems(detail.getRecipeItems().stream().map(Line::from).toList())
            .totalEstimatedCost(detail.getTotalEstimatedCost())
            .costPerUnit(detail.getCostPerUnit())
            .createdAt(batch.getCreatedAt())
            .updatedAt(batch.getUpdatedAt())
            .build();
    }

    @Value
    public static class Line {

        @JsonProperty("raw_item_id")
        String rawItemId;

        @JsonProperty("raw_item_name")
        String rawItemName;

        @JsonProperty("quantity_per_unit")
        BigDecimal quantityPerUnit;

        @JsonProperty("avg_price")
        BigDecimal avgPrice;

        @JsonProperty("total_quantity")
        int totalQuantity;

        @JsonProperty("line_cost")
        BigDecimal lineCost;

        static Line from(BatchDetail.Line line) {
            return new Line(line.getRawItemId(), line.getRawItemName(), line.getQuantityPerUnit(),
                    line.getAvgPrice(), line.getTotalQuantity(), line.getLineCost());
        }
    }
}
