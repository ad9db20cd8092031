package com.flagship.inventory_ledger.stock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.stock.StockLedgerEntry;
import com.flagship.inventory_ledger.stock.StockReferenceType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class StockLedgerEntryResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("item_id")
    String itemId;

    @JsonProperty("reference_type")
    StockReferenceType referenceType;

    @JsonProperty("reference_id")
    String referenceId;

    @JsonProperty("qty_in")
    int qtyIn;

    @JsonProperty("qty_out")
    int qtyOut;

    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("note")
    String note;

    @JsonProperty("created_at")
    Instant createdAt;

    public static StockLedgerEntryResponse from(StockLedgerEntry entry) {
        return StockLedgerEntryResponse.builder()
            .id(entry.getId())
            .itemId(entry.getItemId())
            .referenceType(entry.getReferenceType())
            .referenceId(entry.getReferenceId())
            .qtyIn(entry.getQtyIn())
            .qtyOut(entry.getQtyOut())
            .unitPrice(entry.getUnitPrice())
            .note(entry.getNote())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
