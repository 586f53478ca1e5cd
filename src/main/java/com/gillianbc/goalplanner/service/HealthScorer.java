package com.gillianbc.goalplanner.service;

import com.gillianbc.goalplanner.model.HealthTier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Maps a goal's coverage ratio onto a {@link HealthTier}.
 * <p>
 * Each tier includes its lower bound: coverage of exactly 0.8 is ALMOST_THERE, exactly 1.0
 * is ON_TRACK, and so on.
 */
@Service
public class HealthScorer {

    static final BigDecimal VERY_WEAK_BELOW = new BigDecimal("0.5");
    static final BigDecimal NEEDS_WORK_BELOW = new BigDecimal("0.8");
    static final BigDecimal ALMOST_THERE_BELOW = new BigDecimal("1.0");
    static final BigDecimal ON_TRACK_BELOW = new BigDecimal("1.3");

    /**
     * @param coverage        fvTotal / effectiveTarget
     * @param effectiveTarget inflation-adjusted target; a non-positive target has no meaningful tier
     */
    public HealthTier score(BigDecimal coverage, BigDecimal effectiveTarget) {
        if (effectiveTarget.signum() <= 0) {
            return HealthTier.UNDEFINED;
        }
        if (coverage.compareTo(VERY_WEAK_BELOW) < 0) return HealthTier.VERY_WEAK;
        if (coverage.compareTo(NEEDS_WORK_BELOW) < 0) return HealthTier.NEEDS_WORK;
        if (coverage.compareTo(ALMOST_THERE_BELOW) < 0) return HealthTier.ALMOST_THERE;
        if (coverage.compareTo(ON_TRACK_BELOW) < 0) return HealthTier.ON_TRACK;
        return HealthTier.OVERACHIEVER;
    }
}
