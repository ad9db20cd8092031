package com.flagship.inventory_ledger.production;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a production batch. Stages only move forward, one step at a time.
 */
public enum ProductionStage {
    DRAFT,
    IN_PROCESS,
    DONE;

    private static final Map<ProductionStage, Set<ProductionStage>> TRANSITIONS = new EnumMap<>(ProductionStage.class);

    static {
        TRANSITIONS.put(DRAFT, EnumSet.of(IN_PROCESS));
        TRANSITIONS.put(IN_PROCESS, EnumSet.of(DONE));
        TRANSITIONS.put(DONE, EnumSet.noneOf(ProductionStage.class));
    }

    public boolean canTransitionTo(ProductionStage target) {
        return TRANSITIONS.get(this).contains(target);
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public void requireTransitionTo(ProductionStage target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                    "Invalid stage transition from %s to %s", this, target));
        }
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }
}
