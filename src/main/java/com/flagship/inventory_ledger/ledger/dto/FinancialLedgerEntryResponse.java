package com.flagship.inventory_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.ledger.FinancialLedgerEntry;
import com.flagship.inventory_ledger.ledger.FinancialReferenceType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class FinancialLedgerEntryResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("counterparty_id")
    String counterpartyId;

    @JsonProperty("reference_type")
    FinancialReferenceType referenceType;

    @JsonProperty("reference_id")
    String referenceId;

    @JsonProperty("debit")
    BigDecimal debit;

    @JsonProperty("credit")
    BigDecimal credit;

    @JsonProperty("created_at")
    Instant createdAt;

    public static FinancialLedgerEntryResponse from(FinancialLedgerEntry entry) {
        return FinancialLedgerEntryResponse.builder()
            .id(entry.getId())
            .counterpartyId(entry.getCounterpartyId())
            .referenceType(entry.getReferenceType())
            .referenceId(entry.getReferenceId())
            .debit(entry.getDebit())
            .credit(entry.getCredit())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
