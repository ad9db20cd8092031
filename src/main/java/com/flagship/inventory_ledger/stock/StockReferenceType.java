package com.flagship.inventory_ledger.stock;

/**
 * What caused a stock movement.
 */
public enum StockReferenceType {
    PURCHASE,
    SALE,
    PRODUCTION,
    ADJUSTMENT
}
