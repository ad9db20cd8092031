package com.flagship.inventory_ledger.payment;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.purchase.InvoiceStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * What a supplier is owed, from the ledger and from the open invoices.
 * The two agree unless rows were posted outside the invoice engine, e.g.
 * expenses booked against the supplier.
 */
@Value
public class SupplierOutstanding {

    @JsonProperty("supplier_id")
    String supplierId;

    @JsonProperty("supplier_name")
    String supplierName;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("ledger_balance")
    BigDecimal ledgerBalance;

    @JsonProperty("outstanding_balance")
    BigDecimal outstandingBalance;

    @JsonProperty("outstanding_invoices")
    List<OutstandingInvoice> invoices;

    @JsonProperty("outstanding_invoices_count")
    public int getOutstandingInvoicesCount() {
        return invoices.size();
    }

    @Value
    public static class OutstandingInvoice {

        @JsonProperty("invoice_id")
        String invoiceId;

        @JsonProperty("invoice_date")
        Instant invoiceDate;

        @JsonProperty("total_amount")
        BigDecimal totalAmount;

        @JsonProperty("paid_amount")
        BigDecimal paidAmount;

        @JsonProperty("balance_due")
        BigDecimal balanceDue;

        @JsonProperty("status")
        InvoiceStatus status;

        @JsonProperty("days_outstanding")
        long daysOutstanding;
    }
}
