package com.flagship.inventory_ledger.stock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.stock.StockLedgerPage;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StockLedgerPageResponse {

    @JsonProperty("entries")
    List<StockLedgerEntryResponse> entries;

    @JsonProperty("total")
    long total;

    @JsonProperty("total_qty_in")
    long totalQtyIn;

    @JsonProperty("total_qty_out")
    long totalQtyOut;

    @JsonProperty("offset")
    int offset;

    @JsonProperty("limit")
    int limit;

    public static StockLedgerPageResponse from(StockLedgerPage page) {
        return StockLedgerPageResponse.builder()
            .entries(page.getEntries().stream().map(StockLedgerEntryResponse::from).toList())
            .total(page.getTotal())
            .totalQtyIn(page.getTotalQtyIn())
            .totalQtyOut(page.getTotalQtyOut())
            .offset(page.getOffset())
            .limit(page.getLimit())
            .build();
    }
}
