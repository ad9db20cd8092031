package com.flagship.inventory_ledger.production;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProductionStageTest {

    @Test
    @DisplayName("Stages move forward one step at a time")
    void testAllowedTransitions() {
        assertTrue(ProductionStage.DRAFT.canTransitionTo(ProductionStage.IN_PROCESS));
        assertTrue(ProductionStage.IN_PROCESS.canTransitionTo(ProductionStage.DONE));
    }

    @Test
    @DisplayName("Skipping, repeating and going back are rejected")
    void testRejectedTransitions() {
        assertFalse(ProductionStage.DRAFT.canTransitionTo(ProductionStage.DONE));
        assertFalse(ProductionStage.DRAFT.canTransitionTo(ProductionStage.DRAFT));
        assertFalse(ProductionStage.IN_PROCESS.canTransitionTo(ProductionStage.IN_PROCESS));
        assertFalse(ProductionStage.IN_PROCESS.canTransitionTo(ProductionStage.DRAFT));
        for (ProductionStage target : ProductionStage.values()) {
            assertFalse(ProductionStage.DONE.canTransitionTo(target));
        }
    }

    @Test
    @DisplayName("requireTransitionTo names both stages in its error")
    void testRequireTransition_Message() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ProductionStage.IN_PROCESS.requireTransitionTo(ProductionStage.IN_PROCESS));
        assertEquals("Invalid stage transition from IN_PROCESS to IN_PROCESS", e.getMessage());
    }

    @Test
    @DisplayName("Only DONE is terminal")
    void testTerminal() {
        assertFalse(ProductionStage.DRAFT.isTerminal());
        assertFalse(ProductionStage.IN_PROCESS.isTerminal());
        assertTrue(ProductionStage.DONE.isTerminal());
    }
}
