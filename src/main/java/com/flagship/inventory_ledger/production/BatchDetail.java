package com.flagship.inventory_ledger.production;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A batch with its recipe snapshot priced at current raw averages.
 */
@Value
public class BatchDetail {
    ProductionBatch batch;
    String finalProductName;
    List<Line> recipeItems;
    BigDecimal totalEstimatedCost;
    BigDecimal costPerUnit;

    @Value
    public static class Line {
        String rawItemId;
        String rawItemName;
        BigDecimal quantityPerUnit;
        BigDecimal avgPrice;
        int totalQuantity;
        BigDecimal lineCost;
    }
}
