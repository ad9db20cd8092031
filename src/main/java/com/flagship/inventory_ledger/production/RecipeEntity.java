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
@Table(name = "recipes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class RecipeEntity {

    @Id
    @Column(nullable = false, updatable = false, length = 20)
    private String id;

    @Column(name = "final_product_id", nullable = false, updatable = false, length = 20)
    private String finalProductId;

    @Column
    private String name;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "recipe", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<RecipeItemEntity> items = new ArrayList<>();

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static RecipeEntity create(String id, String finalProductId, String name) {
        return new RecipeEntity(id, finalProductId, name, null, null, new ArrayList<>());
    }

    Recipe toDomain() {
        return new Recipe(id, finalProductId, name, lines(), createdAt, updatedAt);
    }

    List<RecipeLine> lines() {
        return items.stream().map(RecipeItemEntity::toLine).toList();
    }

    void rename(String name) {
        this.name = name;
        // Touch the row so updated_at moves even when only the lines change.
        this.updatedAt = Instant.now();
    }

    void clearLines() {
        items.clear();
    }

    void addLines(List<RecipeLine> lines) {
        for (RecipeLine line : lines) {
            items.add(RecipeItemEntity.create(this, line));
        }
    }
}
