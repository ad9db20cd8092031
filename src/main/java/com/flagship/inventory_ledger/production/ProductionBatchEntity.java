package com.flagship.inventory_ledger.production;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "production_batches")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class ProductionBatchEntity {

    @Id
    @Column(nullable = false, updatable = false, length = 20)
    private String id;

    @Column(name = "final_product_id", nullable = false, updatable = false, length = 20)
    private String finalProductId;

    @Column(name = "quantity_produced", nullable = false)
    private int quantityProduced;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ProductionStage stage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "batch", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<ProductionSerialEntity> serials = new ArrayList<>();

    @OneToMany(mappedBy = "batch", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<BatchRecipeItemEntity> recipeItems = new ArrayList<>();

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static ProductionBatchEntity createDraft(String id, String finalProductId, int quantity) {
        return new ProductionBatchEntity(id, finalProductId, quantity, ProductionStage.DRAFT,
                null, null, new ArrayList<>(), new ArrayList<>());
    }

    ProductionBatch toDomain() {
        return new ProductionBatch(id, finalProductId, quantityProduced, stage,
                serialNumbers(), recipeLines(), createdAt, updatedAt);
    }

    List<String> serialNumbers() {
        return serials.stream().map(ProductionSerialEntity::getSerialNumber).toList();
    }

    List<RecipeLine> recipeLines() {
        return recipeItems.stream().map(BatchRecipeItemEntity::toLine).toList();
    }

    void changeQuantity(int quantity) {
        this.quantityProduced = quantity;
    }

    void clearSerials() {
        serials.clear();
    }

    void addSerials(List<String> serialNumbers) {
        for (String serial : serialNumbers) {
            serials.add(ProductionSerialEntity.create(this, serial));
        }
    }

    void clearRecipe() {
        recipeItems.clear();
    }

    void addRecipeLines(List<RecipeLine> lines) {
        for (RecipeLine line : lines) {
            recipeItems.add(BatchRecipeItemEntity.create(this, line));
        }
    }

    /**
     * @throws IllegalStateException if the stage machine does not allow the move
     */
    ProductionStage advanceTo(ProductionStage target) {
        ProductionStage from = this.stage;
        from.requireTransitionTo(target);
        this.stage = target;
        return from;
    }
}
