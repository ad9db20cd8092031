package com.flagship.inventory_ledger.production;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One line of the recipe snapshot taken when a batch is drafted.
 */
@Entity
@Table(name = "production_batch_recipe_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class BatchRecipeItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "batch_id", nullable = false, updatable = false)
    private ProductionBatchEntity batch;

    @Column(name = "raw_item_id", nullable = false, updatable = false, length = 20)
    private String rawItemId;

    @Column(name = "quantity_per_unit", nullable = false, updatable = false, precision = 15, scale = 4)
    private BigDecimal quantityPerUnit;

    static BatchRecipeItemEntity create(ProductionBatchEntity batch, RecipeLine line) {
        return new BatchRecipeItemEntity(null, batch, line.getRawItemId(), line.getQuantityPerUnit());
    }

    RecipeLine toLine() {
        return RecipeLine.of(rawItemId, quantityPerUnit);
    }
}
