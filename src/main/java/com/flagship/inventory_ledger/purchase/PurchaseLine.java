package com.flagship.inventory_ledger.purchase;

import com.flagship.inventory_ledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One purchased item on an invoice.
 */
@Value
public class PurchaseLine {
    String itemId;
    int quantity;
    BigDecimal unitPrice;

    public static PurchaseLine of(String itemId, int quantity, BigDecimal unitPrice) {
        return new PurchaseLine(itemId, quantity, unitPrice);
    }

    public BigDecimal lineTotal() {
        return Money.of(unitPrice.multiply(BigDecimal.valueOf(quantity)));
    }
}
