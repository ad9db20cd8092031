package com.flagship.inventory_ledger.inventory;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read-only snapshot of an item and its stock aggregates.
 */
@Value
public class Item {
    String id;
    String name;
    ItemType itemType;
    UnitType unitType;
    BigDecimal avgPrice;
    BigDecimal standardCost;
    int totalQuantity;
    Instant createdAt;
    Instant updatedAt;

    public boolean isRawMaterial() {
        return itemType == ItemType.RAW_MATERIAL;
    }

    public boolean isFinalProduct() {
        return itemType == ItemType.FINAL_PRODUCT;
    }

    public StockPosition position() {
        return StockPosition.of(totalQuantity, avgPrice);
    }
}
