package com.flagship.inventory_ledger.inventory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Weighted-average arithmetic without a database.
 */
class CostingEngineTest {

    private static final StockPosition EMPTY = StockPosition.of(0, BigDecimal.ZERO);

    @Test
    @DisplayName("Two receipts at different prices average by quantity")
    void testApplyIncoming_WeightedAverage() {
        StockPosition afterFirst = CostingEngine.applyIncoming(EMPTY, 10, new BigDecimal("2.00"));
        StockPosition afterSecond = CostingEngine.applyIncoming(afterFirst, 5, new BigDecimal("3.50"));

        assertEquals(15, afterSecond.getQuantity());
        assertEquals(0, new BigDecimal("2.50").compareTo(afterSecond.getAvgPrice()),
                "avg should be (10*2.00 + 5*3.50) / 15 = 2.50, was " + afterSecond.getAvgPrice());
    }

    @Test
    @DisplayName("Receipt order does not change the resulting average")
    void testApplyIncoming_OrderIndependent() {
        StockPosition ab = CostingEngine.applyIncoming(
                CostingEngine.applyIncoming(EMPTY, 7, new BigDecimal("4.10")), 3, new BigDecimal("9.90"));
        StockPosition ba = CostingEngine.applyIncoming(
                CostingEngine.applyIncoming(EMPTY, 3, new BigDecimal("9.90")), 7, new BigDecimal("4.10"));

        assertEquals(ab.getQuantity(), ba.getQuantity());
        assertEquals(0, ab.getAvgPrice().compareTo(ba.getAvgPrice()));
    }

    @Test
    @DisplayName("Issuing keeps the average and lowers the quantity")
    void testApplyOutgoing_KeepsAverage() {
        StockPosition position = StockPosition.of(15, new BigDecimal("2.50"));

        StockPosition after = CostingEngine.applyOutgoing(position, 6);

        assertEquals(9, after.getQuantity());
        assertEquals(0, new BigDecimal("2.50").compareTo(after.getAvgPrice()));
    }

    @Test
    @DisplayName("Issuing more than on hand is rejected")
    void testApplyOutgoing_Insufficient() {
        StockPosition position = StockPosition.of(3, new BigDecimal("1.00"));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> CostingEngine.applyOutgoing(position, 4));
        assertTrue(e.getMessage().contains("only 3 on hand"));
    }

    @Test
    @DisplayName("Reversing the last receipt restores the previous position")
    void testReverseIncoming_RestoresPrevious() {
        StockPosition before = CostingEngine.applyIncoming(EMPTY, 10, new BigDecimal("2.00"));
        StockPosition after = CostingEngine.applyIncoming(before, 5, new BigDecimal("3.50"));

        StockPosition reversed = CostingEngine.reverseIncoming(after, 5, new BigDecimal("3.50"));

        assertEquals(10, reversed.getQuantity());
        assertEquals(0, new BigDecimal("2.00").compareTo(reversed.getAvgPrice()));
    }

    @Test
    @DisplayName("Reversing everything resets the average to zero")
    void testReverseIncoming_ToEmpty() {
        StockPosition position = CostingEngine.applyIncoming(EMPTY, 4, new BigDecimal("12.00"));

        StockPosition reversed = CostingEngine.reverseIncoming(position, 4, new BigDecimal("12.00"));

        assertEquals(0, reversed.getQuantity());
        assertEquals(0, BigDecimal.ZERO.compareTo(reversed.getAvgPrice()));
    }

    @Test
    @DisplayName("Reversal with a negative residual value floors the average at zero")
    void testReverseIncoming_NegativeResidualFloored() {
        StockPosition position = StockPosition.of(10, new BigDecimal("1.00"));

        StockPosition reversed = CostingEngine.reverseIncoming(position, 5, new BigDecimal("5.00"));

        assertEquals(5, reversed.getQuantity());
        assertEquals(0, BigDecimal.ZERO.compareTo(reversed.getAvgPrice()));
    }

    @Test
    @DisplayName("Reversing more units than on hand is rejected")
    void testReverseIncoming_TooMany() {
        StockPosition position = StockPosition.of(2, new BigDecimal("1.00"));

        assertThrows(IllegalStateException.class,
                () -> CostingEngine.reverseIncoming(position, 3, new BigDecimal("1.00")));
    }

    @Test
    @DisplayName("Negative quantities and prices are rejected")
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class,
                () -> CostingEngine.applyIncoming(EMPTY, -1, BigDecimal.ONE));
        assertThrows(IllegalArgumentException.class,
                () -> CostingEngine.applyIncoming(EMPTY, 1, new BigDecimal("-0.01")));
        assertThrows(IllegalArgumentException.class,
                () -> CostingEngine.applyOutgoing(EMPTY, -1));
    }
}
