package com.flagship.inventory_ledger.stock;

import lombok.Value;

@Value
public class MovementTotals {
    long qtyIn;
    long qtyOut;

    public long net() {
        return qtyIn - qtyOut;
    }
}
