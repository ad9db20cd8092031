package com.flagship.inventory_ledger.production;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Entity
@Table(name = "recipe_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class RecipeItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "recipe_id", nullable = false, updatable = false)
    private RecipeEntity recipe;

    @Column(name = "raw_item_id", nullable = false, updatable = false, length = 20)
    private String rawItemId;

    @Column(name = "quantity_per_unit", nullable = false, updatable = false, precision = 15, scale = 4)
    private BigDecimal quantityPerUnit;

    static RecipeItemEntity create(RecipeEntity recipe, RecipeLine line) {
        return new RecipeItemEntity(null, recipe, line.getRawItemId(), line.getQuantityPerUnit());
    }

    RecipeLine toLine() {
        return RecipeLine.of(rawItemId, quantityPerUnit);
    }
}
