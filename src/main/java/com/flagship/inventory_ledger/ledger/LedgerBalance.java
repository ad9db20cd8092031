package com.flagship.inventory_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Derived balance of one counterparty: debits minus credits.
 * For a supplier a positive balance is money still owed to them.
 */
@Value
public class LedgerBalance {
    String counterpartyId;
    BigDecimal totalDebit;
    BigDecimal totalCredit;

    public BigDecimal getBalance() {
        return totalDebit.subtract(totalCredit);
    }
}
