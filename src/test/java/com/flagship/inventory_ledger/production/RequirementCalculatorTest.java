package com.flagship.inventory_ledger.production;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class RequirementCalculatorTest {

    @Test
    @DisplayName("Exact requirement is quantity per unit times quantity")
    void testExact() {
        assertEquals(0, new BigDecimal("12").compareTo(RequirementCalculator.exact(new BigDecimal("4"), 3)));
        assertEquals(0, new BigDecimal("1.25").compareTo(RequirementCalculator.exact(new BigDecimal("0.25"), 5)));
    }

    @Test
    @DisplayName("Issued quantity rounds the exact requirement half-up")
    void testIssued_RoundsHalfUp() {
        assertEquals(1, RequirementCalculator.issued(new BigDecimal("0.25"), 5));
        assertEquals(2, RequirementCalculator.issued(new BigDecimal("0.5"), 3));
        assertEquals(0, RequirementCalculator.issued(new BigDecimal("0.1"), 4));
        assertEquals(12, RequirementCalculator.issued(new BigDecimal("4.0000"), 3));
    }

    @Test
    @DisplayName("Max producible is the floor of available over quantity per unit")
    void testMaxProducible() {
        assertEquals(2, RequirementCalculator.maxProducible(10, new BigDecimal("4")));
        assertEquals(40, RequirementCalculator.maxProducible(10, new BigDecimal("0.25")));
        assertEquals(0, RequirementCalculator.maxProducible(0, new BigDecimal("1")));
    }

    @Test
    @DisplayName("A zero quantity per unit cannot bound production")
    void testMaxProducible_ZeroRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> RequirementCalculator.maxProducible(10, BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Max producible is capped at the largest int when stock far exceeds the requirement")
    void testMaxProducible_CappedAtIntRange() {
        assertEquals(Integer.MAX_VALUE, RequirementCalculator.maxProducible(300_000, new BigDecimal("0.0001")));
        assertEquals(Integer.MAX_VALUE,
                RequirementCalculator.maxProducible(Integer.MAX_VALUE, new BigDecimal("0.0001")));
        assertEquals(2_000_000_000, RequirementCalculator.maxProducible(200_000, new BigDecimal("0.0001")));
    }

    @Test
    @DisplayName("Issued quantity beyond int range is returned whole")
    void testIssued_BeyondIntRange() {
        long issued = RequirementCalculator.issued(new BigDecimal("9999.9999"), 1_000_000);
        assertEquals(9_999_999_900L, issued);
        assertTrue(issued > Integer.MAX_VALUE);
    }
}
