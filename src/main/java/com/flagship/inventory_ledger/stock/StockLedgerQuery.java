package com.flagship.inventory_ledger.stock;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Filter for stock ledger listings. Null fields are not applied; dates are
 * inclusive calendar days in UTC.
 */
@Value
@Builder
public class StockLedgerQuery {
    String itemId;
    StockReferenceType referenceType;
    String referenceId;
    String search;
    LocalDate fromDate;
    LocalDate toDate;
    @Builder.Default
    int offset = 0;
    @Builder.Default
    int limit = 50;
}
