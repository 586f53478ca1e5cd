package com.gillianbc.goalplanner.service;

import com.gillianbc.goalplanner.model.AllocationSuggestion;
import com.gillianbc.goalplanner.model.ConflictAssessment;
import com.gillianbc.goalplanner.model.ConflictLevel;
import com.gillianbc.goalplanner.model.Goal;
import com.gillianbc.goalplanner.model.Portfolio;
import com.gillianbc.goalplanner.model.PortfolioBadge;
import com.gillianbc.goalplanner.model.PortfolioSummary;
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
import static com.gillianbc.goalplanner.service.Amounts.money;
import static com.gillianbc.goalplanner.service.Amounts.whole;

/**
 * Cross-goal figures for a portfolio: contribution totals, the average-coverage badge,
 * the income conflict check and a priority-weighted split of a safe share of income.
 * <p>
 * Only reads the goals' stored results; goals that have not been calculated count towards
 * the current contribution total and the allocation but nothing else.
 */
@Slf4j
@Service
public class AggregateAnalyzer {

    /** Share of monthly income considered safe to commit to goals. */
    static final BigDecimal SAFE_INCOME_SHARE = new BigDecimal("0.4");

    private static final BigDecimal HIGH_RISK_BELOW = new BigDecimal("0.7");
    private static final BigDecimal ALMOST_THERE_BELOW = new BigDecimal("1.0");
    private static final BigDecimal ON_TRACK_BELOW = new BigDecimal("1.2");

    private static final BigDecimal EXTREME_ABOVE = BigDecimal.valueOf(60);
    private static final BigDecimal AMBITIOUS_ABOVE = BigDecimal.valueOf(40);
    private static final BigDecimal HEALTHY_ABOVE = BigDecimal.valueOf(20);

    private final InputNormalizer normalizer;

    public AggregateAnalyzer(InputNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public PortfolioSummary summarize(Portfolio portfolio) {
        Objects.requireNonNull(portfolio, "portfolio must not be null");
        BigDecimal totalRequired = totalRequiredContribution(portfolio);
        BigDecimal average = averageCoverage(portfolio);
        return new PortfolioSummary(
                totalCurrentContribution(portfolio),
                totalRequired,
                average,
                badge(average),
                assessConflict(normalizer.toNumber(portfolio.getMonthlyIncome()), totalRequired),
                allocate(portfolio));
    }

    /**
     * Sum of every goal's monthly contribution, calculated or not.
     */
    public BigDecimal totalCurrentContribution(Portfolio portfolio) {
        BigDecimal total = BigDecimal.ZERO;
        for (Goal goal : portfolio.getGoals()) {
            total = total.add(normalizer.toNumber(goal.getInputs().getMonthlyContribution()));
        }
        return money(total);
    }

    /**
     * Sum of the required contributions of the calculated goals.
     */
    public BigDecimal totalRequiredContribution(Portfolio portfolio) {
        BigDecimal total = BigDecimal.ZERO;
        for (Goal goal : portfolio.getGoals()) {
            if (goal.hasResults()) {
                total = total.add(goal.getResults().getMonthlyRequired().max(BigDecimal.ZERO));
            }
        }
        return money(total);
    }

    /**
     * Mean coverage over calculated goals whose coverage is positive; zero when none qualify.
     */
    public BigDecimal averageCoverage(Portfolio portfolio) {
        BigDecimal sum = BigDecimal.ZERO;
        int count = 0;
        for (Goal goal : portfolio.getGoals()) {
            Results results = goal.getResults();
            if (results != null && results.getCoverage().signum() > 0) {
                sum = sum.add(results.getCoverage(), MATH_CONTEXT);
                count++;
            }
        }
        return count == 0 ? BigDecimal.ZERO : sum.divide(BigDecimal.valueOf(count), MATH_CONTEXT);
    }

    public PortfolioBadge badge(BigDecimal averageCoverage) {
        if (averageCoverage.signum() <= 0) return PortfolioBadge.GETTING_STARTED;
        if (averageCoverage.compareTo(HIGH_RISK_BELOW) < 0) return PortfolioBadge.HIGH_RISK_OF_SHORTFALL;
        if (averageCoverage.compareTo(ALMOST_THERE_BELOW) < 0) return PortfolioBadge.ALMOST_THERE;
        if (averageCoverage.compareTo(ON_TRACK_BELOW) < 0) return PortfolioBadge.ON_TRACK;
        return PortfolioBadge.OVERPREPARED;
    }

    /**
     * Compares the total required monthly contribution with monthly income.
     *
     * @param monthlyIncome normalized monthly income
     * @param totalRequired total required contribution across calculated goals
     */
    public ConflictAssessment assessConflict(BigDecimal monthlyIncome, BigDecimal totalRequired) {
        if (monthlyIncome.signum() <= 0) {
            return new ConflictAssessment(ConflictLevel.NEED_INCOME, null,
                    "Add your monthly income to see if your total SIPs make any sense.");
        }
        if (totalRequired.signum() == 0) {
            return new ConflictAssessment(ConflictLevel.CALCULATE_FIRST, null,
                    "Calculate your goals to see if your plan clashes with your income.");
        }

        BigDecimal ratio = totalRequired.divide(monthlyIncome, MATH_CONTEXT).multiply(HUNDRED, MATH_CONTEXT);
        String pct = ratio.setScale(1, RoundingMode.HALF_UP).toPlainString();

        if (ratio.compareTo(EXTREME_ABOVE) > 0) {
            return new ConflictAssessment(ConflictLevel.EXTREME, ratio,
                    "You'd need about " + pct + "% of your income in SIPs. Mathematically possible, "
                            + "practically unhinged. Either reduce some goals or extend timelines.");
        }
        if (ratio.compareTo(AMBITIOUS_ABOVE) > 0) {
            return new ConflictAssessment(ConflictLevel.AMBITIOUS, ratio,
                    "Total required SIP is about " + pct + "% of your income. Ambitious but doable "
                            + "if you're disciplined and not living on constant food delivery.");
        }
        if (ratio.compareTo(HEALTHY_ABOVE) > 0) {
            return new ConflictAssessment(ConflictLevel.HEALTHY, ratio,
                    "Total required SIP is about " + pct + "% of your income. "
                            + "That's a healthy range for long-term goals.");
        }
        return new ConflictAssessment(ConflictLevel.CONSERVATIVE, ratio,
                "Total required SIP is only " + pct + "% of your income. "
                        + "Either your goals are tiny or you're playing it very safe.");
    }

    /**
     * Splits 40% of monthly income across all goals in proportion to their priority
     * (each clamped into [1, 5]), rounded to whole currency units.
     *
     * @return one suggestion per goal in portfolio order, or null when income is not
     * positive or the portfolio has no goals
     */
    public List<AllocationSuggestion> allocate(Portfolio portfolio) {
        BigDecimal income = normalizer.toNumber(portfolio.getMonthlyIncome());
        if (income.signum() <= 0 || portfolio.getGoals().isEmpty()) {
            return null;
        }

        BigDecimal safeMax = income.multiply(SAFE_INCOME_SHARE, MATH_CONTEXT);
        int totalPriority = 0;
        for (Goal goal : portfolio.getGoals()) {
            totalPriority += normalizer.toPriority(goal.getInputs().getPriority());
        }

        List<AllocationSuggestion> suggestions = new ArrayList<>();
        for (Goal goal : portfolio.getGoals()) {
            int priority = normalizer.toPriority(goal.getInputs().getPriority());
            BigDecimal share = BigDecimal.valueOf(priority)
                    .divide(BigDecimal.valueOf(totalPriority), MATH_CONTEXT)
                    .multiply(safeMax, MATH_CONTEXT);
            suggestions.add(new AllocationSuggestion(goal.getId(), goal.displayName(), whole(share)));
        }
        log.debug("Allocated {} of income {} across {} goals", safeMax, income, suggestions.size());
        return List.copyOf(suggestions);
    }
}
