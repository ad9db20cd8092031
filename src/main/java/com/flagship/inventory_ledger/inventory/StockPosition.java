package com.flagship.inventory_ledger.inventory;

import com.flagship.inventory_ledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Quantity on hand and weighted-average unit cost of one item.
 *
 * {@code avgPrice} may carry more than two decimals while the costing engine
 * works with it; {@link #rounded()} produces the persisted form.
 */
@Value
public class StockPosition {
    int quantity;
    BigDecimal avgPrice;

    public static StockPosition of(int quantity, BigDecimal avgPrice) {
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + quantity);
        }
        if (avgPrice == null || avgPrice.signum() < 0) {
            throw new IllegalArgumentException("Average price cannot be negative: " + avgPrice);
        }
        return new StockPosition(quantity, avgPrice);
    }

    public static StockPosition empty() {
        return new StockPosition(0, Money.ZERO);
    }

    public StockPosition rounded() {
        return new StockPosition(quantity, Money.of(avgPrice));
    }

    /**
     * Stock value at the current average, rounded to cents.
     */
    public BigDecimal value() {
        return Money.of(avgPrice.multiply(BigDecimal.valueOf(quantity)));
    }
}
