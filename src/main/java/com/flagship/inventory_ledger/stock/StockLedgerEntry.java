package com.flagship.inventory_ledger.stock;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One immutable stock movement. Exactly one of {@code qtyIn} and
 * {@code qtyOut} is non-zero.
 */
@Value
public class StockLedgerEntry {
    String id;
    String itemId;
    StockReferenceType referenceType;
    String referenceId;
    int qtyIn;
    int qtyOut;
    BigDecimal unitPrice;
    String note;
    Instant createdAt;

    public boolean isIncoming() {
        return qtyIn > 0;
    }
}
