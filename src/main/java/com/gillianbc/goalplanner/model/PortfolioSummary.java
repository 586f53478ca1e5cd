package com.gillianbc.goalplanner.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

/**
 * Cross-goal figures for a portfolio snapshot.
 */
@Getter
@ToString
@AllArgsConstructor
public class PortfolioSummary {
    private final BigDecimal totalCurrentContribution;
    private final BigDecimal totalRequiredContribution;
    /** Zero when no goal qualifies for the average. */
    private final BigDecimal averageCoverage;
    private final PortfolioBadge badge;
    private final ConflictAssessment conflict;
    /** Null when income is not positive or there are no goals. */
    private final List<AllocationSuggestion> allocation;
}
