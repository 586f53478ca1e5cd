package com.gillianbc.goalplanner.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@ToString
@AllArgsConstructor
public class ConflictAssessment {
    private final ConflictLevel level;
    /** Required contributions as a percentage of income; null when it cannot be evaluated. */
    private final BigDecimal requiredPercentOfIncome;
    private final String message;
}
