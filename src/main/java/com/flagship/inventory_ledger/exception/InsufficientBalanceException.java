package com.flagship.inventory_ledger.exception;

import java.math.BigDecimal;

/**
 * A payment exceeds what is still owed on an invoice or to a supplier.
 */
public class InsufficientBalanceException extends RuntimeException {

    private final BigDecimal requested;
    private final BigDecimal outstanding;

    public InsufficientBalanceException(String message, BigDecimal requested, BigDecimal outstanding) {
        super(message);
        this.requested = requested;
        this.outstanding = outstanding;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getOutstanding() {
        return outstanding;
    }
}
