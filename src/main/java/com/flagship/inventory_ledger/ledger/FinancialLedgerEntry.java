package com.flagship.inventory_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One immutable debit or credit against a counterparty.
 */
@Value
public class FinancialLedgerEntry {
    long id;
    String counterpartyId;
    FinancialReferenceType referenceType;
    String referenceId;
    BigDecimal debit;
    BigDecimal credit;
    Instant createdAt;

    public boolean isDebit() {
        return debit.signum() > 0;
    }
}
