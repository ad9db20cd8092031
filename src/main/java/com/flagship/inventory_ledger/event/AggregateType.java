package com.flagship.inventory_ledger.event;

/**
 * Aggregate families that emit events. Each maps to its own Kafka topic.
 */
public enum AggregateType {
    PURCHASE_INVOICE("PurchaseInvoice"),
    PAYMENT("Payment"),
    PRODUCTION_BATCH("ProductionBatch"),
    ITEM("Item");

    private final String code;

    AggregateType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static AggregateType fromCode(String code) {
        for (AggregateType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown aggregate type: " + code);
    }
}
