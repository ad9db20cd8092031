package com.flagship.inventory_ledger.common;

/**
 * Human readable identifier formats. Each code is the prefix followed by
 * {@code length} random uppercase letters.
 */
public enum CodePrefix {
    ITEM("ITM-", 8),
    STOCK_ENTRY("STK-", 8),
    STOCK_ADJUSTMENT("ADJ-", 8),
    PURCHASE_INVOICE("PINV-", 8),
    PAYMENT("PAY-", 8),
    DIRECT_PAYMENT("DPAY-", 8),
    RECIPE("RCP-", 8),
    PRODUCTION_BATCH("PROD-", 5),
    ACCOUNT("ACC-", 8),
    SUPPLIER("SUP-", 8),
    CUSTOMER("CUS-", 8),
    OWNER("OWN-", 8),
    EXPENSE("EXP-", 8);

    private final String prefix;
    private final int length;

    CodePrefix(String prefix, int length) {
        this.prefix = prefix;
        this.length = length;
    }

    public String prefix() {
        return prefix;
    }

    public int length() {
        return length;
    }
}
