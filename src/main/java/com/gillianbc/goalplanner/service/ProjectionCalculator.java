package com.gillianbc.goalplanner.service;

import com.gillianbc.goalplanner.model.GoalInput;
import com.gillianbc.goalplanner.model.HealthTier;
import com.gillianbc.goalplanner.model.NormalizedGoal;
import com.gillianbc.goalplanner.model.ProjectionPoint;
import com.gillianbc.goalplanner.model.Results;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.gillianbc.goalplanner.service.Amounts.HUNDRED;
import static com.gillianbc.goalplanner.service.Amounts.MATH_CONTEXT;
import static com.gillianbc.goalplanner.service.Amounts.TWELVE;
import static com.gillianbc.goalplanner.service.Amounts.money;

/**
 * Projects a single goal: inflation-adjusted target, future value of the current savings
 * and of the monthly contributions, the funding gap and a sampled growth trajectory.
 * <p>
 * Contributions are made at the end of each month and returns compound monthly at
 * annualReturn / 12. A zero return uses straight-line accumulation instead of the
 * annuity formula.
 */
@Slf4j
@Service
public class ProjectionCalculator {

    // Trajectory points are kept for month 1, every SAMPLE_INTERVAL months and the final month
    static final int SAMPLE_INTERVAL = 6;

    // Longer horizons are projected as MAX_YEARS
    static final BigDecimal MAX_YEARS = BigDecimal.valueOf(100);

    private final InputNormalizer normalizer;
    private final RequiredContributionSolver solver;
    private final HealthScorer healthScorer;

    public ProjectionCalculator(InputNormalizer normalizer, RequiredContributionSolver solver, HealthScorer healthScorer) {
        this.normalizer = normalizer;
        this.solver = solver;
        this.healthScorer = healthScorer;
    }

    /**
     * Normalizes the raw inputs and projects them.
     */
    public Results compute(GoalInput inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        return compute(normalizer.normalize(inputs));
    }

    /**
     * Projects already-normalized inputs. Pure function of its argument.
     *
     * @param goal normalized goal parameters
     * @return a complete, immutable {@link Results}
     */
    public Results compute(NormalizedGoal goal) {
        Objects.requireNonNull(goal, "goal must not be null");

        BigDecimal years = goal.getYears();
        BigDecimal effectiveTarget = goal.getTargetAmount()
                .multiply(inflationFactor(years, goal.getInflationRate()), MATH_CONTEXT);

        int months = months(years);
        BigDecimal monthlyRate = monthlyRate(goal.getAnnualReturn());
        BigDecimal savings = goal.getCurrentSavings();
        BigDecimal contribution = goal.getMonthlyContribution();

        BigDecimal fvLump;
        BigDecimal fvSip;
        if (monthlyRate.signum() == 0) {
            fvLump = savings;
            fvSip = contribution.multiply(BigDecimal.valueOf(months));
        } else {
            BigDecimal growth = BigDecimal.ONE.add(monthlyRate, MATH_CONTEXT).pow(months, MATH_CONTEXT);
            fvLump = savings.multiply(growth, MATH_CONTEXT);
            fvSip = contribution.multiply(
                    growth.subtract(BigDecimal.ONE, MATH_CONTEXT).divide(monthlyRate, MATH_CONTEXT),
                    MATH_CONTEXT);
        }

        BigDecimal fvTotal = fvLump.add(fvSip, MATH_CONTEXT);
        BigDecimal coverage = effectiveTarget.signum() > 0
                ? fvTotal.divide(effectiveTarget, MATH_CONTEXT)
                : BigDecimal.ZERO;
        BigDecimal required = solver.solve(effectiveTarget, fvLump, months, monthlyRate);
        HealthTier tier = healthScorer.score(coverage, effectiveTarget);

        log.debug("Projected {} months at {} per month: fvTotal={} effectiveTarget={} coverage={} tier={}",
                months, monthlyRate, fvTotal, effectiveTarget, coverage, tier);

        BigDecimal roundedTotal = money(fvTotal);
        BigDecimal roundedTarget = money(effectiveTarget);
        return new Results(
                money(fvLump),
                money(fvSip),
                roundedTotal,
                roundedTotal.subtract(roundedTarget),
                money(required),
                trajectory(savings, contribution, monthlyRate, months),
                tier,
                coverage,
                roundedTarget);
    }

    /**
     * @return max(1, round(years * 12)), rounding halves up, with years capped at {@link #MAX_YEARS}
     */
    public static int months(BigDecimal years) {
        BigDecimal months = horizon(years).multiply(TWELVE).setScale(0, RoundingMode.HALF_UP);
        return months.signum() <= 0 ? 1 : months.intValueExact();
    }

    static BigDecimal horizon(BigDecimal years) {
        return years.min(MAX_YEARS);
    }

    static BigDecimal monthlyRate(BigDecimal annualReturnPercent) {
        return annualReturnPercent.divide(HUNDRED, MATH_CONTEXT).divide(TWELVE, MATH_CONTEXT);
    }

    /**
     * (1 + inflation/100)^years, or exactly 1 when either the horizon or the inflation rate
     * is not positive. Whole years compound exactly; a fractional remainder is applied
     * through {@link Math#pow}.
     */
    static BigDecimal inflationFactor(BigDecimal years, BigDecimal inflationPercent) {
        if (years.signum() <= 0 || inflationPercent.signum() <= 0) {
            return BigDecimal.ONE;
        }
        BigDecimal base = BigDecimal.ONE.add(inflationPercent.divide(HUNDRED, MATH_CONTEXT), MATH_CONTEXT);
        BigDecimal capped = horizon(years);
        BigDecimal whole = capped.setScale(0, RoundingMode.DOWN);
        BigDecimal fraction = capped.subtract(whole);
        BigDecimal factor = base.pow(whole.intValueExact(), MATH_CONTEXT);
        if (fraction.signum() != 0) {
            factor = factor.multiply(fractionalPower(base, fraction.doubleValue()), MATH_CONTEXT);
        }
        return factor;
    }

    /**
     * base^exponent for 0 < exponent < 1. Bases beyond the double range go through log10.
     */
    private static BigDecimal fractionalPower(BigDecimal base, double exponent) {
        double direct = Math.pow(base.doubleValue(), exponent);
        if (Double.isFinite(direct)) {
            return BigDecimal.valueOf(direct);
        }
        int digits = base.precision() - base.scale() - 1;
        double log10 = digits + Math.log10(base.movePointLeft(digits).doubleValue());
        double scaled = log10 * exponent;
        int magnitude = (int) Math.floor(scaled);
        return BigDecimal.valueOf(Math.pow(10, scaled - magnitude)).scaleByPowerOfTen(magnitude);
    }

    /**
     * Replays the growth month by month, keeping month 1, every sixth month and the last month.
     * This is a display sample, not a full monthly series.
     */
    private static List<ProjectionPoint> trajectory(BigDecimal savings, BigDecimal contribution,
                                                    BigDecimal monthlyRate, int months) {
        List<ProjectionPoint> points = new ArrayList<>();
        BigDecimal growth = BigDecimal.ONE.add(monthlyRate, MATH_CONTEXT);
        BigDecimal value = savings;
        for (int month = 1; month <= months; month++) {
            if (monthlyRate.signum() == 0) {
                value = value.add(contribution);
            } else {
                value = value.multiply(growth, MATH_CONTEXT).add(contribution, MATH_CONTEXT);
            }
            if (month == 1 || month % SAMPLE_INTERVAL == 0 || month == months) {
                points.add(new ProjectionPoint(month, yearLabel(month), money(value)));
            }
        }
        return points;
    }

    static String yearLabel(int month) {
        return BigDecimal.valueOf(month).divide(TWELVE, 1, RoundingMode.HALF_UP).toPlainString() + "y";
    }
}
