package com.flagship.inventory_ledger.inventory;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Movement totals from the stock ledger next to the item's running aggregates.
 * {@code ledgerConsistent} is false when the two disagree.
 */
@Value
public class ItemStockSummary {

    @JsonProperty("item_id")
    String itemId;

    @JsonProperty("name")
    String name;

    @JsonProperty("item_type")
    ItemType itemType;

    @JsonProperty("unit_type")
    UnitType unitType;

    @JsonProperty("total_qty_in")
    long totalQtyIn;

    @JsonProperty("total_qty_out")
    long totalQtyOut;

    @JsonProperty("current_quantity")
    int currentQuantity;

    @JsonProperty("avg_price")
    BigDecimal avgPrice;

    @JsonProperty("unit_cost")
    BigDecimal unitCost;

    @JsonProperty("total_value")
    BigDecimal totalValue;

    @JsonProperty("ledger_consistent")
    public boolean isLedgerConsistent() {
        return totalQtyIn - totalQtyOut == currentQuantity;
    }
}
