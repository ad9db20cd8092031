package com.flagship.inventory_ledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding rules for monetary amounts.
 *
 * Every persisted or returned amount carries two decimal places rounded
 * half-up. Intermediate cost arithmetic keeps {@link #INTERNAL_SCALE} places
 * and is only rounded when it leaves the engine.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final int INTERNAL_SCALE = 10;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Money() {
    }

    public static BigDecimal of(BigDecimal amount) {
        return amount == null ? ZERO : amount.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal of(String amount) {
        return of(new BigDecimal(amount));
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    /**
     * Validates that a user supplied amount is strictly positive and returns it rounded.
     */
    public static BigDecimal requirePositive(BigDecimal amount, String field) {
        if (!isPositive(amount)) {
            throw new IllegalArgumentException(field + " must be greater than 0");
        }
        BigDecimal rounded = of(amount);
        if (rounded.signum() == 0) {
            throw new IllegalArgumentException(field + " must be at least 0.01");
        }
        return rounded;
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, INTERNAL_SCALE, ROUNDING);
    }
}
