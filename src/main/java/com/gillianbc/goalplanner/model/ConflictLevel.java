package com.gillianbc.goalplanner.model;

/**
 * How the total required monthly contribution compares with monthly income.
 */
public enum ConflictLevel {
    NEED_INCOME,
    CALCULATE_FIRST,
    /** More than 60% of income. */
    EXTREME,
    /** Over 40% up to 60%. */
    AMBITIOUS,
    /** Over 20% up to 40%. */
    HEALTHY,
    /** 20% or less. */
    CONSERVATIVE
}
