package com.flagship.inventory_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.ledger.FinancialLedgerPage;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class FinancialLedgerPageResponse {

    @JsonProperty("entries")
    List<FinancialLedgerEntryResponse> entries;

    @JsonProperty("total")
    long total;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("offset")
    int offset;

    @JsonProperty("limit")
    int limit;

    public static FinancialLedgerPageResponse from(FinancialLedgerPage page) {
        return FinancialLedgerPageResponse.builder()
            .entries(page.getEntries().stream().map(FinancialLedgerEntryResponse::from).toList())
            .total(page.getTotal())
            .totalDebit(page.getTotalDebit())
            .totalCredit(page.getTotalCredit())
            .offset(page.getOffset())
            .limit(page.getLimit())
            .build();
    }
}
