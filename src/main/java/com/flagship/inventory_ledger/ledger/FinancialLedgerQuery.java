package com.flagship.inventory_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class FinancialLedgerQuery {
    String counterpartyId;
    FinancialReferenceType referenceType;
    String search;
    LocalDate fromDate;
    LocalDate toDate;
    @Builder.Default
    int offset = 0;
    @Builder.Default
    int limit = 50;
}
