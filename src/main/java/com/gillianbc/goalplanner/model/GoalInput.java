package com.gillianbc.goalplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Raw goal parameters exactly as entered by the user.
 * <p>
 * Every numeric field is kept as free-form text; conversion to numbers happens once,
 * in {@link com.gillianbc.goalplanner.service.InputNormalizer}. A {@code null} field is
 * stored as an empty string.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
public class GoalInput {

    private final String goalName;
    private final String goalType;
    private final String targetAmount;
    private final String years;
    private final String currentSavings;
    private final String monthlyContribution;
    /** Expected annual return in percent (e.g. "12" for 12%). */
    private final String annualReturn;
    /** Expected annual inflation in percent. */
    private final String inflationRate;
    /** Contribution streak in months. Display only, never used in the projection math. */
    private final String monthsInvested;
    /** 1 (lowest) to 5 (highest). */
    private final String priority;

    @Builder(toBuilder = true)
    @JsonCreator
    public GoalInput(@JsonProperty("goalName") String goalName,
                     @JsonProperty("goalType") String goalType,
                     @JsonProperty("targetAmount") String targetAmount,
                     @JsonProperty("years") String years,
                     @JsonProperty("currentSavings") String currentSavings,
                     @JsonProperty("monthlyContribution") String monthlyContribution,
                     @JsonProperty("annualReturn") String annualReturn,
                     @JsonProperty("inflationRate") String inflationRate,
                     @JsonProperty("monthsInvested") String monthsInvested,
                     @JsonProperty("priority") String priority) {
        this.goalName = blankIfNull(goalName);
        this.goalType = blankIfNull(goalType);
        this.targetAmount = blankIfNull(targetAmount);
        this.years = blankIfNull(years);
        this.currentSavings = blankIfNull(currentSavings);
        this.monthlyContribution = blankIfNull(monthlyContribution);
        this.annualReturn = blankIfNull(annualReturn);
        this.inflationRate = blankIfNull(inflationRate);
        this.monthsInvested = blankIfNull(monthsInvested);
        this.priority = blankIfNull(priority);
    }

    /**
     * Starting values used for the first goal of a new portfolio and for every goal
     * added afterwards (with a different name).
     */
    public static GoalInput defaults() {
        return GoalInput.builder()
                .goalName("Master's abroad fund")
                .goalType("Education")
                .targetAmount("1500000")
                .years("5")
                .currentSavings("50000")
                .monthlyContribution("10000")
                .annualReturn("12")
                .inflationRate("5")
                .monthsInvested("0")
                .priority("3")
                .build();
    }

    private static String blankIfNull(String value) {
        return value == null ? "" : value;
    }
}
