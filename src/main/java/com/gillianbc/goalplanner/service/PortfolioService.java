package com.gillianbc.goalplanner.service;

import com.gillianbc.goalplanner.model.Goal;
import com.gillianbc.goalplanner.model.GoalInput;
import com.gillianbc.goalplanner.model.Portfolio;
import com.gillianbc.goalplanner.model.RiskProfile;
import com.gillianbc.goalplanner.store.PortfolioStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Portfolio transitions. Every operation takes a snapshot and returns a new one;
 * nothing is held between calls apart from the store used by {@link #load()} and {@link #save}.
 */
@Slf4j
@Service
public class PortfolioService {

    private final ProjectionCalculator calculator;
    private final PortfolioStore store;

    public PortfolioService(ProjectionCalculator calculator, PortfolioStore store) {
        this.calculator = calculator;
        this.store = store;
    }

    /**
     * A single default goal (id 1), moderate risk and no income.
     */
    public Portfolio defaultPortfolio() {
        return new Portfolio(List.of(new Goal(1, GoalInput.defaults())), RiskProfile.MODERATE, "");
    }

    /**
     * Appends an uncalculated goal with default inputs, named "New goal {id}",
     * where id is one more than the highest existing id (1 for an empty portfolio).
     */
    public Portfolio addGoal(Portfolio portfolio) {
        Objects.requireNonNull(portfolio, "portfolio must not be null");
        int nextId = nextId(portfolio);
        GoalInput inputs = GoalInput.defaults().toBuilder().goalName("New goal " + nextId).build();
        List<Goal> goals = new ArrayList<>(portfolio.getGoals());
        goals.add(new Goal(nextId, inputs));
        return portfolio.withGoals(goals);
    }

    public int nextId(Portfolio portfolio) {
        return portfolio.getGoals().stream().mapToInt(Goal::getId).max().orElse(0) + 1;
    }

    /**
     * Removes a goal. The last remaining goal is never removed; an unknown id is ignored.
     */
    public Portfolio removeGoal(Portfolio portfolio, int goalId) {
        Objects.requireNonNull(portfolio, "portfolio must not be null");
        if (portfolio.getGoals().size() <= 1) {
            return portfolio;
        }
        List<Goal> goals = new ArrayList<>();
        for (Goal goal : portfolio.getGoals()) {
            if (goal.getId() != goalId) {
                goals.add(goal);
            }
        }
        return portfolio.withGoals(goals);
    }

    /**
     * Replaces a goal's inputs. Its last results are kept until it is recalculated.
     *
     * @throws IllegalArgumentException if the goal does not exist
     */
    public Portfolio updateInputs(Portfolio portfolio, int goalId, GoalInput inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        return replaceGoal(portfolio, goalId, goal -> goal.withInputs(inputs));
    }

    /**
     * Recomputes one goal's results from its current inputs.
     *
     * @throws IllegalArgumentException if the goal does not exist
     */
    public Portfolio calculate(Portfolio portfolio, int goalId) {
        return replaceGoal(portfolio, goalId, goal -> goal.withResults(calculator.compute(goal.getInputs())));
    }

    public Portfolio calculateAll(Portfolio portfolio) {
        Objects.requireNonNull(portfolio, "portfolio must not be null");
        List<Goal> goals = new ArrayList<>();
        for (Goal goal : portfolio.getGoals()) {
            goals.add(goal.withResults(calculator.compute(goal.getInputs())));
        }
        return portfolio.withGoals(goals);
    }

    /**
     * Switches the risk profile and resets the given goal's expected return to the
     * profile's default. Other goals keep their returns.
     */
    public Portfolio changeRiskProfile(Portfolio portfolio, RiskProfile profile, int goalId) {
        Objects.requireNonNull(profile, "profile must not be null");
        String defaultReturn = Integer.toString(profile.getDefaultReturn());
        Portfolio updated = replaceGoal(portfolio, goalId,
                goal -> goal.withInputs(goal.getInputs().toBuilder().annualReturn(defaultReturn).build()));
        return updated.withRiskProfile(profile);
    }

    public Portfolio withMonthlyIncome(Portfolio portfolio, String monthlyIncome) {
        Objects.requireNonNull(portfolio, "portfolio must not be null");
        return portfolio.withMonthlyIncome(monthlyIncome);
    }

    /**
     * Restores the stored portfolio, falling back to {@link #defaultPortfolio()} when
     * nothing usable is stored. A stored record without goals keeps the default goal but
     * still restores the risk profile and income.
     */
    public Portfolio load() {
        Optional<Portfolio> stored = store.load();
        if (stored.isEmpty()) {
            return defaultPortfolio();
        }
        Portfolio portfolio = stored.get();
        if (portfolio.getGoals().isEmpty()) {
            log.info("Stored portfolio has no goals, starting with the default goal");
            return defaultPortfolio()
                    .withRiskProfile(portfolio.getRiskProfile())
                    .withMonthlyIncome(portfolio.getMonthlyIncome());
        }
        return portfolio;
    }

    /**
     * Persists the snapshot. A failed write is logged and otherwise ignored.
     */
    public void save(Portfolio portfolio) {
        Objects.requireNonNull(portfolio, "portfolio must not be null");
        try {
            store.save(portfolio);
        } catch (UncheckedIOException e) {
            log.error("Portfolio not saved, continuing with the in-memory snapshot", e);
        }
    }

    private Portfolio replaceGoal(Portfolio portfolio, int goalId, UnaryOperator<Goal> change) {
        Objects.requireNonNull(portfolio, "portfolio must not be null");
        if (portfolio.findGoal(goalId).isEmpty()) {
            throw new IllegalArgumentException("No goal with id " + goalId);
        }
        List<Goal> goals = new ArrayList<>();
        for (Goal goal : portfolio.getGoals()) {
            goals.add(goal.getId() == goalId ? change.apply(goal) : goal);
        }
        return portfolio.withGoals(goals);
    }
}
