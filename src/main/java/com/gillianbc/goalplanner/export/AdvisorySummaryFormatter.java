package com.gillianbc.goalplanner.export;

import com.gillianbc.goalplanner.model.Goal;
import com.gillianbc.goalplanner.model.GoalInput;
import com.gillianbc.goalplanner.model.Results;
import com.gillianbc.goalplanner.model.RiskProfile;
import com.gillianbc.goalplanner.service.CurrencyFormatter;
import com.gillianbc.goalplanner.service.InputNormalizer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Multi-line plain-text summary of one goal, meant to be pasted into a note or sent to an adviser.
 * Lines for values that are missing are left out.
 */
@Component
public class AdvisorySummaryFormatter {

    private final InputNormalizer normalizer;
    private final CurrencyFormatter currency;

    public AdvisorySummaryFormatter(InputNormalizer normalizer, CurrencyFormatter currency) {
        this.normalizer = normalizer;
        this.currency = currency;
    }

    public String format(Goal goal, RiskProfile riskProfile) {
        Objects.requireNonNull(goal, "goal must not be null");
        Objects.requireNonNull(riskProfile, "riskProfile must not be null");
        GoalInput i = goal.getInputs();
        Results r = goal.getResults();

        List<String> lines = new ArrayList<>();
        lines.add("Goal: " + orDefault(i.getGoalName(), "Unnamed goal"));
        lines.add("Type: " + orDefault(i.getGoalType(), "Not specified"));
        lines.add("Time horizon: " + orDefault(i.getYears(), "-") + " years");
        if (!i.getTargetAmount().isEmpty()) {
            lines.add("Base target today: " + currency.format(normalizer.toNumber(i.getTargetAmount())));
        }
        if (r != null) {
            lines.add("Inflation-adjusted target at " + orDefault(i.getInflationRate(), "0") + "%: "
                    + currency.format(r.getEffectiveTarget()));
        }
        if (!i.getCurrentSavings().isEmpty()) {
            lines.add("Current savings: " + currency.format(normalizer.toNumber(i.getCurrentSavings())));
        }
        if (!i.getMonthlyContribution().isEmpty()) {
            lines.add("Current monthly SIP: " + currency.format(normalizer.toNumber(i.getMonthlyContribution())));
        }
        if (r != null) {
            lines.add("Projected total at " + orDefault(i.getAnnualReturn(), "0") + "%: "
                    + currency.format(r.getFvTotal()));
            lines.add("Coverage vs inflation-adjusted target: "
                    + r.getCoverage().multiply(BigDecimal.valueOf(100)).setScale(1, RoundingMode.HALF_UP).toPlainString()
                    + "%");
            lines.add("Required monthly SIP to fully fund: "
                    + currency.format(r.getMonthlyRequired().max(BigDecimal.ZERO)));
        }
        lines.add("Risk profile: " + riskProfile.getKey());

        return String.join("\n", lines);
    }

    private static String orDefault(String value, String fallback) {
        return value.isEmpty() ? fallback : value;
    }
}
