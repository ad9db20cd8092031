package com.flagship.inventory_ledger.inventory;

import com.flagship.inventory_ledger.common.Money;

import java.math.BigDecimal;

/**
 * Weighted-average cost arithmetic.
 *
 * All functions are pure: they take a position and return the next one.
 * Persistence and locking live in {@link InventoryValuationService}.
 *
 * Reversal is algebraic and only exact when no other movement touched the
 * item since the receipt being reversed; the average is not recomputed from
 * history.
 */
public final class CostingEngine {

    private CostingEngine() {
    }

    /**
     * Receives {@code quantity} units at {@code unitPrice}:
     * {@code newAvg = (q*a + qty*p) / (q + qty)}.
     */
    public static StockPosition applyIncoming(StockPosition position, int quantity, BigDecimal unitPrice) {
        requireNonNegative(quantity);
        requireNonNegativePrice(unitPrice);

        int newQuantity = position.getQuantity() + quantity;
        if (newQuantity == 0) {
            return StockPosition.of(0, BigDecimal.ZERO);
        }
        BigDecimal existingValue = position.getAvgPrice().multiply(BigDecimal.valueOf(position.getQuantity()));
        BigDecimal incomingValue = unitPrice.multiply(BigDecimal.valueOf(quantity));
        BigDecimal newAvg = Money.divide(existingValue.add(incomingValue), BigDecimal.valueOf(newQuantity));
        return StockPosition.of(newQuantity, newAvg);
    }

    /**
     * Issues {@code quantity} units. The average cost is unchanged.
     *
     * @throws IllegalStateException if fewer units are on hand
     */
    public static StockPosition applyOutgoing(StockPosition position, int quantity) {
        requireNonNegative(quantity);
        if (quantity > position.getQuantity()) {
            throw new IllegalStateException(String.format(
                    "Cannot issue %d units, only %d on hand", quantity, position.getQuantity()));
        }
        return StockPosition.of(position.getQuantity() - quantity, position.getAvgPrice());
    }

    /**
     * Undoes an earlier receipt of {@code quantity} units at {@code unitPrice}:
     * {@code newAvg = (a*q - qty*p) / (q - qty)}, zero when nothing remains.
     * A negative residual value is floored at zero.
     *
     * @throws IllegalStateException if the received units are no longer on hand
     */
    public static StockPosition reverseIncoming(StockPosition position, int quantity, BigDecimal unitPrice) {
        requireNonNegative(quantity);
        requireNonNegativePrice(unitPrice);
        if (quantity > position.getQuantity()) {
            throw new IllegalStateException(String.format(
                    "Cannot reverse receipt of %d units, only %d on hand", quantity, position.getQuantity()));
        }

        int newQuantity = position.getQuantity() - quantity;
        if (newQuantity == 0) {
            return StockPosition.of(0, BigDecimal.ZERO);
        }
        BigDecimal currentValue = position.getAvgPrice().multiply(BigDecimal.valueOf(position.getQuantity()));
        BigDecimal reversedValue = unitPrice.multiply(BigDecimal.valueOf(quantity));
        BigDecimal remainingValue = currentValue.subtract(reversedValue).max(BigDecimal.ZERO);
        return StockPosition.of(newQuantity, Money.divide(remainingValue, BigDecimal.valueOf(newQuantity)));
    }

    private static void requireNonNegative(int quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + quantity);
        }
    }

    private static void requireNonNegativePrice(BigDecimal unitPrice) {
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new IllegalArgumentException("Unit price cannot be negative: " + unitPrice);
        }
    }
}
