package com.sentindex.common.delta;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Percentage change between two index levels, e.g. {@code 1.50} for a 1.5% rise.
 */
public final class IndexDeltaCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private IndexDeltaCalculator() {}

    /**
     * @return {@code (current − previous) / previous × 100}, half-even to 2 decimals;
     *         {@code 0.00} when {@code previous} is missing or not positive
     */
    public static BigDecimal deltaPct(BigDecimal current, BigDecimal previous) {
        if (current == null || previous == null || previous.signum() <= 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return current.subtract(previous)
            .divide(previous, MathContext.DECIMAL128)
            .multiply(HUNDRED)
            .setScale(2, RoundingMode.HALF_EVEN);
    }
}
