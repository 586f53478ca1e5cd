package com.gillianbc.goalplanner.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Portfolio-wide verdict based on the average coverage of the calculated goals.
 */
@Getter
@RequiredArgsConstructor
public enum PortfolioBadge {
    GETTING_STARTED("Getting started", "🐣"),
    HIGH_RISK_OF_SHORTFALL("High risk of shortfall", "🔥"),
    ALMOST_THERE("Almost there", "🙂"),
    ON_TRACK("On track", "✅"),
    OVERPREPARED("Overprepared", "🐐");

    private final String label;
    private final String emoji;
}
