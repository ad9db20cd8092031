package com.flagship.inventory_ledger.party;

public enum AccountType {
    CASH,
    BANK,
    WALLET
}
