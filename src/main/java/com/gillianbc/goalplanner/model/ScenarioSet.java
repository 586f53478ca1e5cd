package com.gillianbc.goalplanner.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * What-if projections for one goal, each with a single input changed.
 */
@Getter
@ToString
@AllArgsConstructor
public class ScenarioSet {
    /** Horizon extended by two years. */
    private final Results extraYears;
    /** Monthly contribution raised by 2000. */
    private final Results extraContribution;
    /** Target lowered by 200000, never below zero. */
    private final Results reducedTarget;
}
