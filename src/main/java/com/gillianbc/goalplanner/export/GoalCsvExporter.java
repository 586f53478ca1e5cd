package com.gillianbc.goalplanner.export;

import com.gillianbc.goalplanner.model.Goal;
import com.gillianbc.goalplanner.model.GoalInput;
import com.gillianbc.goalplanner.model.Portfolio;
import com.gillianbc.goalplanner.model.Results;
import com.gillianbc.goalplanner.service.InputNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;

/**
 * Flattens a portfolio into one CSV row per goal for the goals dashboard download.
 * Every value is quoted; values that are absent (empty input, goal not calculated) are empty.
 */
@Slf4j
@Component
public class GoalCsvExporter {

    public static final String FILE_NAME = "goals-dashboard.csv";

    static final String[] HEADERS = {
            "Goal ID",
            "Goal Name",
            "Goal Type",
            "Priority",
            "Base Target",
            "Inflation Rate",
            "Inflation Adjusted Target",
            "Years",
            "Current Savings",
            "Monthly SIP",
            "Expected Return",
            "Projected Total",
            "Coverage %",
            "Health Label"
    };

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(HEADERS)
            .setQuoteMode(QuoteMode.ALL)
            .setRecordSeparator("\n")
            .build();

    private final InputNormalizer normalizer;

    public GoalCsvExporter(InputNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public String toCsv(Portfolio portfolio) {
        StringWriter out = new StringWriter();
        write(portfolio, out);
        return out.toString();
    }

    /**
     * Writes the header and one row per goal. The writer is flushed but left open.
     *
     * @throws UncheckedIOException if the writer fails
     */
    public void write(Portfolio portfolio, Writer out) {
        Objects.requireNonNull(portfolio, "portfolio must not be null");
        Objects.requireNonNull(out, "out must not be null");
        try {
            CSVPrinter printer = new CSVPrinter(out, FORMAT);
            for (Goal goal : portfolio.getGoals()) {
                printer.printRecord(row(goal));
            }
            printer.flush();
        } catch (IOException e) {
            log.error("Failed to export {} goal(s) to CSV", portfolio.getGoals().size(), e);
            throw new UncheckedIOException("Failed to export goals", e);
        }
    }

    List<String> row(Goal goal) {
        GoalInput i = goal.getInputs();
        Results r = goal.getResults();
        BigDecimal target = normalizer.toNumber(i.getTargetAmount());
        BigDecimal effective = r == null ? BigDecimal.ZERO : r.getEffectiveTarget();

        return List.of(
                Integer.toString(goal.getId()),
                i.getGoalName(),
                i.getGoalType(),
                i.getPriority(),
                target.signum() != 0 ? wholeAmount(target) : "",
                i.getInflationRate(),
                effective.signum() != 0 ? wholeAmount(effective) : "",
                i.getYears(),
                i.getCurrentSavings(),
                i.getMonthlyContribution(),
                i.getAnnualReturn(),
                r != null ? wholeAmount(r.getFvTotal()) : "",
                r != null ? coveragePercent(r) : "",
                r != null ? r.getHealthTier().getLabel() : "");
    }

    private static String wholeAmount(BigDecimal value) {
        return value.setScale(0, RoundingMode.HALF_UP).toPlainString();
    }

    private static String coveragePercent(Results r) {
        return r.getCoverage().multiply(BigDecimal.valueOf(100)).setScale(1, RoundingMode.HALF_UP).toPlainString();
    }
}
