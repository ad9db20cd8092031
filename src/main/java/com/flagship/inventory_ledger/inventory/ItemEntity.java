package com.flagship.inventory_ledger.inventory;

import com.flagship.inventory_ledger.common.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for items.
 *
 * {@code totalQuantity}, {@code avgPrice} and {@code standardCost} have no
 * public mutators. Only {@link InventoryValuationService} changes them, and
 * always on a row it holds a write lock for.
 */
@Entity
@Table(name = "items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ItemEntity {

    @Id
    @Column(nullable = false, updatable = false, length = 20)
    private String id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_type", nullable = false, updatable = false, length = 20)
    private ItemType itemType;

    @Enumerated(EnumType.STRING)
    @Column(name = "unit_type", nullable = false, length = 10)
    private UnitType unitType;

    @Column(name = "avg_price", nullable = false, precision = 15, scale = 2)
    private BigDecimal avgPrice;

    @Column(name = "standard_cost", precision = 15, scale = 2)
    private BigDecimal standardCost;

    @Column(name = "total_quantity", nullable = false)
    private int totalQuantity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static ItemEntity create(String id, String name, ItemType itemType, UnitType unitType) {
        return new ItemEntity(id, name, itemType, unitType, Money.ZERO, null, 0, null, null);
    }

    public Item toDomain() {
        return new Item(id, name, itemType, unitType, avgPrice, standardCost, totalQuantity, createdAt, updatedAt);
    }

    StockPosition position() {
        return StockPosition.of(totalQuantity, avgPrice);
    }

    void applyPosition(StockPosition position) {
        StockPosition rounded = position.rounded();
        this.totalQuantity = rounded.getQuantity();
        this.avgPrice = rounded.getAvgPrice();
    }

    void applyStandardCost(BigDecimal cost) {
        if (itemType != ItemType.FINAL_PRODUCT) {
            throw new IllegalStateException("Standard cost only applies to final products: " + id);
        }
        this.standardCost = cost == null ? null : Money.of(cost);
    }

    void rename(String name, UnitType unitType) {
        this.name = name;
        this.unitType = unitType;
    }
}
