package com.flagship.inventory_ledger.production;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Raw material arithmetic for production runs.
 *
 * Stock moves in whole units, so the quantity actually issued for a batch
 * is the exact requirement rounded half-up.
 */
public final class RequirementCalculator {

    private RequirementCalculator() {
    }

    /**
     * Exact requirement, {@code qpu * quantity}.
     */
    public static BigDecimal exact(BigDecimal quantityPerUnit, int quantity) {
        return quantityPerUnit.multiply(BigDecimal.valueOf(quantity));
    }

    private static final BigDecimal INT_LIMIT = BigDecimal.valueOf(Integer.MAX_VALUE);

    /**
     * Whole units issued from stock for a batch. May exceed any stock level,
     * so the result is checked against availability as a long.
     */
    public static long issued(BigDecimal quantityPerUnit, int quantity) {
        return exact(quantityPerUnit, quantity).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    /**
     * How many units the available stock of one raw item supports,
     * {@code floor(available / qpu)}.
     */
    public static int maxProducible(int available, BigDecimal quantityPerUnit) {
        if (quantityPerUnit.signum() <= 0) {
            throw new IllegalArgumentException("Quantity per unit must be positive");
        }
        BigDecimal supported = BigDecimal.valueOf(available).divide(quantityPerUnit, 0, RoundingMode.FLOOR);
        return supported.compareTo(INT_LIMIT) > 0 ? Integer.MAX_VALUE : supported.intValue();
    }
}
