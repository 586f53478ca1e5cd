package com.gillianbc.goalplanner.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Suggested monthly contribution for one goal, in whole currency units.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class AllocationSuggestion {
    private final int goalId;
    private final String name;
    private final BigDecimal suggestedContribution;
}
