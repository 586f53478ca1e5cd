package com.gillianbc.goalplanner.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Quick-glance verdict on a single goal, derived from its coverage ratio.
 */
@Getter
@RequiredArgsConstructor
public enum HealthTier {
    UNDEFINED("🤷", "Set a goal first"),
    VERY_WEAK("😱", "Very weak - huge shortfall"),
    NEEDS_WORK("😬", "Needs work - underfunded"),
    ALMOST_THERE("🙂", "Almost there - close to target"),
    ON_TRACK("😎", "On track - goal covered"),
    OVERACHIEVER("🐐", "Overachiever - well above target");

    private final String emoji;
    private final String label;
}
