package com.flagship.inventory_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class FinancialLedgerPage {
    List<FinancialLedgerEntry> entries;
    long total;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    int offset;
    int limit;
}
