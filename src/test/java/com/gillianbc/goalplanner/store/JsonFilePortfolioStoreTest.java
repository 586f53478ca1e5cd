package com.gillianbc.goalplanner.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.goalplanner.config.GoalPlannerConfig;
import com.gillianbc.goalplanner.model.Goal;
import com.gillianbc.goalplanner.model.GoalInput;
import com.gillianbc.goalplanner.model.Portfolio;
import com.gillianbc.goalplanner.model.Results;
import com.gillianbc.goalplanner.model.RiskProfile;
import com.gillianbc.goalplanner.service.HealthScorer;
import com.gillianbc.goalplanner.service.InputNormalizer;
import com.gillianbc.goalplanner.service.ProjectionCalculator;
import com.gillianbc.goalplanner.service.RequiredContributionSolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFilePortfolioStoreTest {

    private static final String KEY = "goal-planner-v1";

    private final ObjectMapper objectMapper = new GoalPlannerConfig().objectMapper();
    private final ProjectionCalculator calculator = new ProjectionCalculator(
            new InputNormalizer(), new RequiredContributionSolver(), new HealthScorer());

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Record is written under <key>.json and read back with inputs and results")
    void saveThenLoad_roundTrip() {
        JsonFilePortfolioStore store = new JsonFilePortfolioStore(objectMapper, tempDir, KEY);
        Results results = calculator.compute(GoalInput.defaults());
        Portfolio portfolio = new Portfolio(List.of(
                new Goal(1, GoalInput.defaults(), results),
                new Goal(3, GoalInput.defaults().toBuilder().goalName("Car").build())),
                RiskProfile.AGGRESSIVE, "85000");

        store.save(portfolio);

        assertEquals(tempDir.resolve("goal-planner-v1.json"), store.getFile());
        assertTrue(Files.isRegularFile(store.getFile()));
        Portfolio loaded = store.load().orElseThrow();
        assertEquals(RiskProfile.AGGRESSIVE, loaded.getRiskProfile());
        assertEquals("85000", loaded.getMonthlyIncome());
        assertEquals(2, loaded.getGoals().size());

        Goal first = loaded.getGoals().get(0);
        assertEquals(1, first.getId());
        assertEquals(GoalInput.defaults(), first.getInputs());
        assertEquals(0, results.getFvTotal().compareTo(first.getResults().getFvTotal()));
        assertEquals(0, results.getCoverage().compareTo(first.getResults().getCoverage()));
        assertEquals(results.getHealthTier(), first.getResults().getHealthTier());
        assertEquals(results.getProjection().size(), first.getResults().getProjection().size());

        Goal second = loaded.getGoals().get(1);
        assertEquals(3, second.getId());
        assertEquals("Car", second.getInputs().getGoalName());
        assertFalse(second.hasResults());
    }

    @Test
    @DisplayName("Missing file loads as empty")
    void load_missing_empty() {
        assertEquals(Optional.empty(), new JsonFilePortfolioStore(objectMapper, tempDir, KEY).load());
    }

    @Test
    @DisplayName("Malformed or wrongly shaped JSON loads as empty instead of failing")
    void load_corrupt_empty() throws IOException {
        JsonFilePortfolioStore store = new JsonFilePortfolioStore(objectMapper, tempDir, KEY);

        for (String corrupt : new String[]{
                "{not json",
                "",
                "null",
                "{\"goals\":\"oops\"}",
                "{\"goals\":[{\"id\":1}]}",
                "{\"goals\":[{\"id\":1,\"inputs\":{},\"results\":{\"monthlyRequired\":-5}}]}"}) {
            Files.writeString(store.getFile(), corrupt, StandardCharsets.UTF_8);
            assertEquals(Optional.empty(), store.load(), "should ignore: " + corrupt);
        }
    }

    @Test
    @DisplayName("Record in the planner's plain shape loads; unknown fields and risk profiles are tolerated")
    void load_plainRecord() throws IOException {
        String json = "{\"goals\":[{\"id\":4,\"inputs\":{\"goalName\":\"Trip\",\"targetAmount\":\"200000\","
                + "\"years\":\"2\",\"priority\":\"4\",\"colour\":\"blue\"},\"results\":null}],"
                + "\"riskProfile\":\"yolo\",\"monthlyIncome\":\"60000\",\"activeGoalId\":4}";
        JsonFilePortfolioStore store = new JsonFilePortfolioStore(objectMapper, tempDir, KEY);
        Files.writeString(store.getFile(), json, StandardCharsets.UTF_8);

        Portfolio loaded = store.load().orElseThrow();

        assertEquals(RiskProfile.MODERATE, loaded.getRiskProfile());
        Goal goal = loaded.getGoals().get(0);
        assertEquals(4, goal.getId());
        assertEquals("Trip", goal.getInputs().getGoalName());
        assertEquals("", goal.getInputs().getCurrentSavings());
        assertFalse(goal.hasResults());
    }

    @Test
    @DisplayName("Save creates missing directories")
    void save_createsDirectory() {
        JsonFilePortfolioStore store = new JsonFilePortfolioStore(objectMapper, tempDir.resolve("a").resolve("b"), KEY);

        store.save(new Portfolio(List.of(), RiskProfile.CONSERVATIVE, ""));

        assertEquals(RiskProfile.CONSERVATIVE, store.load().orElseThrow().getRiskProfile());
    }

    @Test
    @DisplayName("Unwritable location surfaces as UncheckedIOException")
    void save_unwritable_throws() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
        JsonFilePortfolioStore store = new JsonFilePortfolioStore(objectMapper, blocker.resolve("nested"), KEY);

        assertThrows(UncheckedIOException.class, () -> store.save(new Portfolio(List.of(), RiskProfile.MODERATE, "")));
    }

    @Test
    @DisplayName("Failed replace leaves no temporary file behind")
    void save_moveFails_removesTempFile() throws IOException {
        JsonFilePortfolioStore store = new JsonFilePortfolioStore(objectMapper, tempDir, KEY);
        // a non-empty directory where the record should go cannot be replaced
        Files.createDirectories(store.getFile());
        Files.writeString(store.getFile().resolve("keep"), "x");

        assertThrows(UncheckedIOException.class, () -> store.save(new Portfolio(List.of(), RiskProfile.MODERATE, "")));

        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(store.getFile()), files.toList());
        }
    }
}
