package com.flagship.inventory_ledger.purchase;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Purchase totals for one supplier across all of its invoices.
 */
@Value
public class PurchaseSummary {

    @JsonProperty("supplier_id")
    String supplierId;

    @JsonProperty("invoice_count")
    int invoiceCount;

    @JsonProperty("unpaid_count")
    int unpaidCount;

    @JsonProperty("partial_count")
    int partialCount;

    @JsonProperty("paid_count")
    int paidCount;

    @JsonProperty("total_purchased")
    BigDecimal totalPurchased;

    @JsonProperty("total_paid")
    BigDecimal totalPaid;

    @JsonProperty("total_due")
    BigDecimal totalDue;
}
