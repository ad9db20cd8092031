package com.flagship.inventory_ledger.ledger;

/**
 * What a financial ledger row records.
 *
 * PURCHASE and PURCHASE_UPDATE and EXPENSE rows reference the invoice or
 * expense id; PAYMENT and PAYMENT_REVERSAL rows reference a payment id;
 * DIRECT_PAYMENT rows reference the lump-sum payment reference.
 */
public enum FinancialReferenceType {
    PURCHASE,
    PURCHASE_UPDATE,
    PAYMENT,
    DIRECT_PAYMENT,
    PAYMENT_REVERSAL,
    EXPENSE
}
