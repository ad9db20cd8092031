package com.flagship.inventory_ledger.party;

import lombok.Value;

import java.time.Instant;

/**
 * Cash box, bank account or wallet that money is paid from.
 */
@Value
public class PaymentAccount {
    String id;
    String name;
    AccountType accountType;
    Instant createdAt;
}
