package com.flagship.inventory_ledger.payment;

/**
 * How a lump-sum supplier payment is spread over open invoices.
 */
public enum AllocationMethod {
    /** Oldest invoice first. */
    FIFO,
    /** Newest invoice first. */
    LIFO,
    /** Every invoice in proportion to its balance due. */
    PROPORTIONAL
}
