package com.flagship.inventory_ledger.party;

import lombok.Value;

import java.time.Instant;

@Value
public class Counterparty {
    String id;
    String name;
    CounterpartyRole role;
    Instant createdAt;

    public boolean isSupplier() {
        return role == CounterpartyRole.SUPPLIER;
    }
}
