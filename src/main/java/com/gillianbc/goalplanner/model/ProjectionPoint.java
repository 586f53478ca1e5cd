package com.gillianbc.goalplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One sampled point of a goal's growth trajectory.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ProjectionPoint {

    private final int month;
    /** Years elapsed to one decimal place, e.g. "2.5y". */
    @NonNull private final String yearLabel;
    @NonNull private final BigDecimal value;

    @JsonCreator
    public ProjectionPoint(@JsonProperty("month") int month,
                           @JsonProperty("yearLabel") String yearLabel,
                           @JsonProperty("value") BigDecimal value) {
        if (month < 1) {
            throw new IllegalArgumentException("month must be >= 1");
        }
        this.month = month;
        this.yearLabel = Objects.requireNonNull(yearLabel, "yearLabel must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }
}
