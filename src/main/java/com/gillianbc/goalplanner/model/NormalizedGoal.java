package com.gillianbc.goalplanner.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Numeric view of a {@link GoalInput} after normalization. Rates are still in percent.
 */
@Getter
@ToString
@AllArgsConstructor
public class NormalizedGoal {
    private final BigDecimal targetAmount;
    private final BigDecimal years;
    private final BigDecimal currentSavings;
    private final BigDecimal monthlyContribution;
    private final BigDecimal annualReturn;
    private final BigDecimal inflationRate;
    private final int priority;
}
