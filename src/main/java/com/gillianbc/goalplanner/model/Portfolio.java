package com.gillianbc.goalplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of everything the planner knows: the goals (in display order),
 * the risk profile and the monthly income as entered.
 * <p>
 * This is also the shape of the persisted record.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
public class Portfolio {

    private final List<Goal> goals;
    private final RiskProfile riskProfile;
    /** Raw monthly income text; normalized wherever it is used. */
    private final String monthlyIncome;

    @JsonCreator
    public Portfolio(@JsonProperty("goals") List<Goal> goals,
                     @JsonProperty("riskProfile") RiskProfile riskProfile,
                     @JsonProperty("monthlyIncome") String monthlyIncome) {
        this.goals = goals == null ? List.of() : List.copyOf(goals);
        this.riskProfile = riskProfile == null ? RiskProfile.MODERATE : riskProfile;
        this.monthlyIncome = monthlyIncome == null ? "" : monthlyIncome;
    }

    public Optional<Goal> findGoal(int id) {
        return goals.stream().filter(g -> g.getId() == id).findFirst();
    }

    public Portfolio withGoals(List<Goal> newGoals) {
        return new Portfolio(Objects.requireNonNull(newGoals, "newGoals must not be null"), riskProfile, monthlyIncome);
    }

    public Portfolio withRiskProfile(RiskProfile newProfile) {
        return new Portfolio(goals, Objects.requireNonNull(newProfile, "newProfile must not be null"), monthlyIncome);
    }

    public Portfolio withMonthlyIncome(String newIncome) {
        return new Portfolio(goals, riskProfile, newIncome);
    }
}
