package com.gillianbc.goalplanner.service;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Objects;

import static com.gillianbc.goalplanner.service.Amounts.MATH_CONTEXT;

/**
 * Inverts the annuity future-value formula to find the monthly contribution that closes
 * the gap between the lump-sum projection and the effective target.
 */
@Service
public class RequiredContributionSolver {

    /**
     * @param effectiveTarget inflation-adjusted target
     * @param fvLump          future value of the current savings alone
     * @param months          number of monthly contributions (>= 1)
     * @param monthlyRate     monthly return as a fraction (e.g. 0.01 for 1%)
     * @return required monthly contribution, unrounded and never negative
     */
    public BigDecimal solve(BigDecimal effectiveTarget, BigDecimal fvLump, int months, BigDecimal monthlyRate) {
        Objects.requireNonNull(effectiveTarget, "effectiveTarget must not be null");
        Objects.requireNonNull(fvLump, "fvLump must not be null");
        Objects.requireNonNull(monthlyRate, "monthlyRate must not be null");
        if (months < 1) {
            throw new IllegalArgumentException("months must be >= 1");
        }

        BigDecimal needed = effectiveTarget.subtract(fvLump, MATH_CONTEXT);
        if (needed.signum() <= 0) {
            // savings alone already reach the target
            return BigDecimal.ZERO;
        }
        BigDecimal denominator = BigDecimal.ONE.add(monthlyRate, MATH_CONTEXT)
                .pow(months, MATH_CONTEXT)
                .subtract(BigDecimal.ONE, MATH_CONTEXT);
        // (1 + rm)^n - 1 is zero for rm = 0, and also for rm = -2 over an even number of months
        if (monthlyRate.signum() == 0 || denominator.signum() == 0) {
            return needed.divide(BigDecimal.valueOf(months), MATH_CONTEXT);
        }
        BigDecimal required = needed.multiply(monthlyRate, MATH_CONTEXT).divide(denominator, MATH_CONTEXT);
        return required.signum() < 0 ? BigDecimal.ZERO : required;
    }
}
