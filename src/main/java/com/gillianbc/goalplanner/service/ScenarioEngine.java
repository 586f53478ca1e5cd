package com.gillianbc.goalplanner.service;

import com.gillianbc.goalplanner.model.Goal;
import com.gillianbc.goalplanner.model.GoalInput;
import com.gillianbc.goalplanner.model.ScenarioSet;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * What-if projections for a goal. Each scenario projects a copy of the goal's inputs with
 * exactly one field changed; the goal itself is never modified.
 */
@Service
public class ScenarioEngine {

    static final BigDecimal EXTRA_YEARS = BigDecimal.valueOf(2);
    static final BigDecimal EXTRA_CONTRIBUTION = BigDecimal.valueOf(2000);
    static final BigDecimal TARGET_REDUCTION = BigDecimal.valueOf(200000);

    private final ProjectionCalculator calculator;
    private final InputNormalizer normalizer;

    public ScenarioEngine(ProjectionCalculator calculator, InputNormalizer normalizer) {
        this.calculator = calculator;
        this.normalizer = normalizer;
    }

    public ScenarioSet explore(Goal goal) {
        Objects.requireNonNull(goal, "goal must not be null");
        return explore(goal.getInputs());
    }

    public ScenarioSet explore(GoalInput base) {
        Objects.requireNonNull(base, "base must not be null");
        return new ScenarioSet(
                calculator.compute(withExtraYears(base)),
                calculator.compute(withExtraContribution(base)),
                calculator.compute(withReducedTarget(base)));
    }

    GoalInput withExtraYears(GoalInput base) {
        BigDecimal years = normalizer.toNumber(base.getYears()).add(EXTRA_YEARS);
        return base.toBuilder().years(years.toPlainString()).build();
    }

    GoalInput withExtraContribution(GoalInput base) {
        BigDecimal contribution = normalizer.toNumber(base.getMonthlyContribution()).add(EXTRA_CONTRIBUTION);
        return base.toBuilder().monthlyContribution(contribution.toPlainString()).build();
    }

    GoalInput withReducedTarget(GoalInput base) {
        BigDecimal target = normalizer.toNumber(base.getTargetAmount()).subtract(TARGET_REDUCTION).max(BigDecimal.ZERO);
        return base.toBuilder().targetAmount(target.toPlainString()).build();
    }
}
