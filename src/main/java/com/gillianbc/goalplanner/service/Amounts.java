package com.gillianbc.goalplanner.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Shared precision and rounding rules for the projection math.
 */
final class Amounts {

    static final MathContext MATH_CONTEXT = new MathContext(20, RoundingMode.HALF_UP);
    static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    static final BigDecimal TWELVE = BigDecimal.valueOf(12);

    private Amounts() {
    }

    /** Rounds a currency amount for output: 2 dp, HALF_UP. */
    static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    /** Rounds to whole currency units. */
    static BigDecimal whole(BigDecimal value) {
        return value.setScale(0, RoundingMode.HALF_UP);
    }
}
