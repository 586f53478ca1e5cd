package com.gillianbc.goalplanner.service;

import com.gillianbc.goalplanner.model.AllocationSuggestion;
import com.gillianbc.goalplanner.model.ConflictAssessment;
import com.gillianbc.goalplanner.model.ConflictLevel;
import com.gillianbc.goalplanner.model.Goal;
import com.gillianbc.goalplanner.model.GoalInput;
import com.gillianbc.goalplanner.model.HealthTier;
import com.gillianbc.goalplanner.model.Portfolio;
import com.gillianbc.goalplanner.model.PortfolioBadge;
import com.gillianbc.goalplanner.model.PortfolioSummary;
import com.gillianbc.goalplanner.model.Results;
import com.gillianbc.goalplanner.model.RiskProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AggregateAnalyzerTest {

    private final AggregateAnalyzer analyzer = new AggregateAnalyzer(new InputNormalizer());

    @Test
    @DisplayName("Empty portfolio gives zero totals, no badge progress and no allocation")
    void summarize_emptyPortfolio_neutralDefaults() {
        PortfolioSummary summary = analyzer.summarize(new Portfolio(List.of(), RiskProfile.MODERATE, "50000"));

        assertEquals(new BigDecimal("0.00"), summary.getTotalCurrentContribution());
        assertEquals(new BigDecimal("0.00"), summary.getTotalRequiredContribution());
        assertEquals(BigDecimal.ZERO, summary.getAverageCoverage());
        assertEquals(PortfolioBadge.GETTING_STARTED, summary.getBadge());
        assertEquals(ConflictLevel.CALCULATE_FIRST, summary.getConflict().getLevel());
        assertNull(summary.getAllocation());
    }

    @Test
    @DisplayName("Current total counts every goal; required total only calculated goals")
    void totals_mixOfCalculatedAndPending() {
        Portfolio portfolio = portfolio("",
                new Goal(1, input("10000", "3"), results("0.9", "12000.50")),
                new Goal(2, input("2500.25", "3")),
                new Goal(3, input("abc", "3"), results("1.4", "0.00")));

        assertEquals(new BigDecimal("12500.25"), analyzer.totalCurrentContribution(portfolio));
        assertEquals(new BigDecimal("12000.50"), analyzer.totalRequiredContribution(portfolio));
    }

    @Test
    @DisplayName("Average coverage skips goals without results or with zero coverage")
    void averageCoverage_excludesPendingAndZero() {
        Portfolio portfolio = portfolio("",
                new Goal(1, input("1000", "3"), results("0.6", "100")),
                new Goal(2, input("1000", "3")),
                new Goal(3, input("1000", "3"), results("0", "0")),
                new Goal(4, input("1000", "3"), results("1.0", "0")));

        assertEquals(0, new BigDecimal("0.8").compareTo(analyzer.averageCoverage(portfolio)));
        assertEquals(PortfolioBadge.ALMOST_THERE, analyzer.summarize(portfolio).getBadge());
    }

    @Test
    @DisplayName("Badge cut points at 0.7, 1.0 and 1.2")
    void badge_boundaries() {
        assertEquals(PortfolioBadge.GETTING_STARTED, analyzer.badge(BigDecimal.ZERO));
        assertEquals(PortfolioBadge.HIGH_RISK_OF_SHORTFALL, analyzer.badge(new BigDecimal("0.01")));
        assertEquals(PortfolioBadge.HIGH_RISK_OF_SHORTFALL, analyzer.badge(new BigDecimal("0.69")));
        assertEquals(PortfolioBadge.ALMOST_THERE, analyzer.badge(new BigDecimal("0.7")));
        assertEquals(PortfolioBadge.ON_TRACK, analyzer.badge(new BigDecimal("1.0")));
        assertEquals(PortfolioBadge.ON_TRACK, analyzer.badge(new BigDecimal("1.19")));
        assertEquals(PortfolioBadge.OVERPREPARED, analyzer.badge(new BigDecimal("1.2")));
    }

    @Test
    @DisplayName("Conflict check needs income, then calculated goals")
    void assessConflict_preconditions() {
        assertEquals(ConflictLevel.NEED_INCOME,
                analyzer.assessConflict(BigDecimal.ZERO, new BigDecimal("5000")).getLevel());
        assertEquals(ConflictLevel.NEED_INCOME,
                analyzer.assessConflict(new BigDecimal("-1"), new BigDecimal("5000")).getLevel());

        ConflictAssessment noGoals = analyzer.assessConflict(new BigDecimal("100000"), new BigDecimal("0.00"));
        assertEquals(ConflictLevel.CALCULATE_FIRST, noGoals.getLevel());
        assertNull(noGoals.getRequiredPercentOfIncome());
    }

    @Test
    @DisplayName("Conflict tiers: above 60 extreme, (40,60] ambitious, (20,40] healthy, otherwise conservative")
    void assessConflict_tiers() {
        BigDecimal income = new BigDecimal("100000");

        assertEquals(ConflictLevel.EXTREME, analyzer.assessConflict(income, new BigDecimal("60001")).getLevel());
        assertEquals(ConflictLevel.AMBITIOUS, analyzer.assessConflict(income, new BigDecimal("60000")).getLevel());
        assertEquals(ConflictLevel.AMBITIOUS, analyzer.assessConflict(income, new BigDecimal("40001")).getLevel());
        assertEquals(ConflictLevel.HEALTHY, analyzer.assessConflict(income, new BigDecimal("40000")).getLevel());
        assertEquals(ConflictLevel.HEALTHY, analyzer.assessConflict(income, new BigDecimal("20001")).getLevel());
        assertEquals(ConflictLevel.CONSERVATIVE, analyzer.assessConflict(income, new BigDecimal("20000")).getLevel());
        assertEquals(ConflictLevel.CONSERVATIVE, analyzer.assessConflict(income, new BigDecimal("1")).getLevel());
    }

    @Test
    @DisplayName("Conflict message quotes the percentage to one decimal place")
    void assessConflict_message() {
        ConflictAssessment assessment = analyzer.assessConflict(new BigDecimal("80000"), new BigDecimal("22328.82"));

        assertEquals(ConflictLevel.HEALTHY, assessment.getLevel());
        assertEquals("Total required SIP is about 27.9% of your income. That's a healthy range for long-term goals.",
                assessment.getMessage());
    }

    @Test
    @DisplayName("Allocation splits 40% of income by clamped priority, rounded to whole units")
    void allocate_priorityWeighted() {
        Portfolio portfolio = portfolio("100000",
                new Goal(1, input("1000", "3").toBuilder().goalName("House").build()),
                new Goal(2, input("1000", "0").toBuilder().goalName("").build()),
                new Goal(7, input("1000", "9").toBuilder().goalName("Retirement").build()));

        List<AllocationSuggestion> allocation = analyzer.allocate(portfolio);

        assertEquals(List.of(
                new AllocationSuggestion(1, "House", new BigDecimal("13333")),
                new AllocationSuggestion(2, "Goal 2", new BigDecimal("4444")),
                new AllocationSuggestion(7, "Retirement", new BigDecimal("22222"))), allocation);
    }

    @Test
    @DisplayName("No allocation without a positive income")
    void allocate_noIncome_null() {
        assertNull(analyzer.allocate(portfolio("", new Goal(1, input("1000", "3")))));
        assertNull(analyzer.allocate(portfolio("-500", new Goal(1, input("1000", "3")))));
        assertNull(analyzer.allocate(portfolio("not a number", new Goal(1, input("1000", "3")))));
    }

    @Test
    @DisplayName("Summarizing never touches the goals' stored results")
    void summarize_readsOnly() {
        Results stored = results("0.9", "5000");
        Goal goal = new Goal(1, input("4000", "3"), stored);
        Portfolio portfolio = portfolio("20000", goal);

        PortfolioSummary summary = analyzer.summarize(portfolio);

        assertSame(stored, portfolio.getGoals().get(0).getResults());
        assertEquals(ConflictLevel.HEALTHY, summary.getConflict().getLevel());
        assertTrue(summary.getConflict().getMessage().contains("25.0%"));
        assertEquals(new BigDecimal("8000"), summary.getAllocation().get(0).getSuggestedContribution());
    }

    private static Portfolio portfolio(String income, Goal... goals) {
        return new Portfolio(List.of(goals), RiskProfile.MODERATE, income);
    }

    private static GoalInput input(String monthlyContribution, String priority) {
        return GoalInput.defaults().toBuilder()
                .monthlyContribution(monthlyContribution)
                .priority(priority)
                .build();
    }

    private static Results results(String coverage, String monthlyRequired) {
        BigDecimal target = new BigDecimal("100000.00");
        BigDecimal total = target.multiply(new BigDecimal(coverage));
        return new Results(BigDecimal.ZERO, total, total, total.subtract(target), new BigDecimal(monthlyRequired),
                List.of(), HealthTier.ON_TRACK, new BigDecimal(coverage), target);
    }
}
