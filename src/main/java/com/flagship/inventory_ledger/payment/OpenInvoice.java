package com.flagship.inventory_ledger.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An invoice with a balance due, as seen by the allocator.
 */
@Value
public class OpenInvoice {
    String invoiceId;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    BigDecimal balanceDue;
    Instant createdAt;
}
