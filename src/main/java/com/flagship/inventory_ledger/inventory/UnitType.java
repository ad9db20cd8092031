package com.flagship.inventory_ledger.inventory;

public enum UnitType {
    PCS,
    SET
}
