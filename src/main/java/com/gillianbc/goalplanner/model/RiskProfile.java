package com.gillianbc.goalplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Investor risk appetite. Each profile suggests a default expected annual return.
 */
@Getter
@RequiredArgsConstructor
public enum RiskProfile {
    CONSERVATIVE("conservative", 8, "Conservative - lower risk, lower expected return."),
    MODERATE("moderate", 12, "Moderate - balanced risk and return."),
    AGGRESSIVE("aggressive", 16, "Aggressive - higher risk, higher expected return.");

    @JsonValue
    private final String key;
    /** Default expected annual return in percent. */
    private final int defaultReturn;
    private final String description;

    /**
     * Lenient lookup used when reading stored state; anything unrecognised is MODERATE.
     */
    @JsonCreator
    public static RiskProfile fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (RiskProfile profile : values()) {
                if (profile.key.equals(normalized)) {
                    return profile;
                }
            }
        }
        return MODERATE;
    }
}
