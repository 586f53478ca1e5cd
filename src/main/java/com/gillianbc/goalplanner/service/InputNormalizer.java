package com.gillianbc.goalplanner.service;

import com.gillianbc.goalplanner.model.GoalInput;
import com.gillianbc.goalplanner.model.NormalizedGoal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * The single place where free-form text becomes numbers.
 * <p>
 * Normalization is total: anything that is not a finite decimal number (empty text,
 * {@code null}, words, "Infinity", "NaN") becomes zero. Nothing here throws.
 */
@Slf4j
@Service
public class InputNormalizer {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    // Optional sign, digits with an optional fraction (or a bare fraction), optional exponent
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d{1,4})?");

    /**
     * @param raw user text, may be null
     * @return the parsed value, or zero when the text is not a finite number
     */
    public BigDecimal toNumber(String raw) {
        if (raw == null) {
            return BigDecimal.ZERO;
        }
        String text = raw.trim();
        if (!DECIMAL.matcher(text).matches()) {
            if (!text.isEmpty()) {
                log.debug("Treating non-numeric input '{}' as 0", text);
            }
            return BigDecimal.ZERO;
        }
        return new BigDecimal(text);
    }

    /**
     * Parses a priority, rounds it to a whole number and clamps it into [1, 5].
     * Unparseable text therefore ends up as the lowest priority.
     */
    public int toPriority(String raw) {
        BigDecimal value = toNumber(raw).setScale(0, RoundingMode.HALF_UP);
        if (value.compareTo(BigDecimal.valueOf(MIN_PRIORITY)) < 0) {
            return MIN_PRIORITY;
        }
        if (value.compareTo(BigDecimal.valueOf(MAX_PRIORITY)) > 0) {
            return MAX_PRIORITY;
        }
        return value.intValueExact();
    }

    public NormalizedGoal normalize(GoalInput inputs) {
        return new NormalizedGoal(
                toNumber(inputs.getTargetAmount()),
                toNumber(inputs.getYears()),
                toNumber(inputs.getCurrentSavings()),
                toNumber(inputs.getMonthlyContribution()),
                toNumber(inputs.getAnnualReturn()),
                toNumber(inputs.getInflationRate()),
                toPriority(inputs.getPriority()));
    }
}
