package com.gillianbc.goalplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of projecting a single goal. Amounts are rounded to 2 decimal places.
 * A recalculation always produces a new instance; fields are never patched.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
public class Results {

    /** Future value of the current savings. */
    @NonNull private final BigDecimal fvLump;
    /** Future value of the monthly contributions. */
    @NonNull private final BigDecimal fvSip;
    @NonNull private final BigDecimal fvTotal;
    /** fvTotal - effectiveTarget; negative means shortfall. */
    @NonNull private final BigDecimal gap;
    /** Monthly contribution that would exactly reach the effective target (>= 0). */
    @NonNull private final BigDecimal monthlyRequired;
    @NonNull private final List<ProjectionPoint> projection;
    @NonNull private final HealthTier healthTier;
    @NonNull private final BigDecimal coverage;
    /** Target amount adjusted for inflation over the horizon. */
    @NonNull private final BigDecimal effectiveTarget;

    @JsonCreator
    public Results(@JsonProperty("fvLump") BigDecimal fvLump,
                   @JsonProperty("fvSip") BigDecimal fvSip,
                   @JsonProperty("fvTotal") BigDecimal fvTotal,
                   @JsonProperty("gap") BigDecimal gap,
                   @JsonProperty("monthlyRequired") BigDecimal monthlyRequired,
                   @JsonProperty("projection") List<ProjectionPoint> projection,
                   @JsonProperty("healthTier") HealthTier healthTier,
                   @JsonProperty("coverage") BigDecimal coverage,
                   @JsonProperty("effectiveTarget") BigDecimal effectiveTarget) {
        this.fvLump = Objects.requireNonNull(fvLump, "fvLump must not be null");
        this.fvSip = Objects.requireNonNull(fvSip, "fvSip must not be null");
        this.fvTotal = Objects.requireNonNull(fvTotal, "fvTotal must not be null");
        this.gap = Objects.requireNonNull(gap, "gap must not be null");
        this.monthlyRequired = Objects.requireNonNull(monthlyRequired, "monthlyRequired must not be null");
        if (monthlyRequired.signum() < 0) {
            throw new IllegalArgumentException("monthlyRequired must be >= 0");
        }
        this.projection = List.copyOf(Objects.requireNonNull(projection, "projection must not be null"));
        this.healthTier = Objects.requireNonNull(healthTier, "healthTier must not be null");
        this.coverage = Objects.requireNonNull(coverage, "coverage must not be null");
        this.effectiveTarget = Objects.requireNonNull(effectiveTarget, "effectiveTarget must not be null");
    }
}
