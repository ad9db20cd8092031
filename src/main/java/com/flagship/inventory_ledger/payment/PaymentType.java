package com.flagship.inventory_ledger.payment;

import java.math.BigDecimal;

public enum PaymentType {
    FULL,
    PARTIAL,
    UN_PAID;

    /**
     * Classifies a payment against the balance that was due when it was made.
     */
    public static PaymentType of(BigDecimal amount, BigDecimal balanceDue) {
        if (amount.compareTo(balanceDue) >= 0) {
            return FULL;
        }
        if (amount.signum() > 0) {
            return PARTIAL;
        }
        return UN_PAID;
    }
}
