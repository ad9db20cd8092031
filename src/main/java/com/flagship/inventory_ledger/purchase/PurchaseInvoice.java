package com.flagship.inventory_ledger.purchase;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
public class PurchaseInvoice {
    String id;
    String supplierId;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    BigDecimal balanceDue;
    InvoiceStatus paymentStatus;
    List<PurchaseLine> lines;
    Instant createdAt;
    Instant updatedAt;

    public boolean isPaid() {
        return paymentStatus == InvoiceStatus.PAID;
    }
}
