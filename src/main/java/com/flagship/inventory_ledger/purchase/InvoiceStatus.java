package com.flagship.inventory_ledger.purchase;

import java.math.BigDecimal;

/**
 * Payment status of a purchase invoice, always derived from its amounts.
 */
public enum InvoiceStatus {
    UNPAID,
    PARTIAL,
    PAID;

    public static InvoiceStatus of(BigDecimal totalAmount, BigDecimal paidAmount) {
        if (paidAmount.compareTo(totalAmount) >= 0) {
            return PAID;
        }
        if (paidAmount.signum() > 0) {
            return PARTIAL;
        }
        return UNPAID;
    }
}
