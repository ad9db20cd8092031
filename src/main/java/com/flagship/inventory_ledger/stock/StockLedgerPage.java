package com.flagship.inventory_ledger.stock;

import lombok.Value;

import java.util.List;

/**
 * A page of movements with quantity totals over the whole filtered set.
 */
@Value
public class StockLedgerPage {
    List<StockLedgerEntry> entries;
    long total;
    long totalQtyIn;
    long totalQtyOut;
    int offset;
    int limit;
}
