package com.flagship.inventory_ledger.inventory;

public enum ItemType {
    RAW_MATERIAL,
    FINAL_PRODUCT
}
