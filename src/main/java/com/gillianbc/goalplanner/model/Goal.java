package com.gillianbc.goalplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;

/**
 * A savings goal within a portfolio: its raw inputs plus the last computed results,
 * which stay absent until the goal is explicitly calculated.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public class Goal {

    private final int id;
    private final GoalInput inputs;
    private final Results results;

    @JsonCreator
    public Goal(@JsonProperty("id") int id,
                @JsonProperty("inputs") GoalInput inputs,
                @JsonProperty("results") Results results) {
        this.id = id;
        this.inputs = Objects.requireNonNull(inputs, "inputs must not be null");
        this.results = results;
    }

    public Goal(int id, GoalInput inputs) {
        this(id, inputs, null);
    }

    public Optional<Results> findResults() {
        return Optional.ofNullable(results);
    }

    public boolean hasResults() {
        return results != null;
    }

    /**
     * Same goal with new inputs. The previous results are carried over as the last
     * computed snapshot until the goal is recalculated.
     */
    public Goal withInputs(GoalInput newInputs) {
        return new Goal(id, newInputs, results);
    }

    public Goal withResults(Results newResults) {
        return new Goal(id, inputs, Objects.requireNonNull(newResults, "newResults must not be null"));
    }

    /**
     * @return the goal name, or "Goal {id}" when the name is blank
     */
    public String displayName() {
        String name = inputs.getGoalName();
        return name.isBlank() ? "Goal " + id : name;
    }
}
