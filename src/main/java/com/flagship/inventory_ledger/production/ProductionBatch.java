package com.flagship.inventory_ledger.production;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A production run of one final product, with its serial numbers and the
 * recipe snapshot it consumes.
 */
@Value
public class ProductionBatch {
    String id;
    String finalProductId;
    int quantityProduced;
    ProductionStage stage;
    List<String> serialNumbers;
    List<RecipeLine> recipeLines;
    Instant createdAt;
    Instant updatedAt;

    public boolean isDraft() {
        return stage == ProductionStage.DRAFT;
    }
}
