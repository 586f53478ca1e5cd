package com.gillianbc.goalplanner.service;

import com.gillianbc.goalplanner.model.GoalInput;
import com.gillianbc.goalplanner.model.Portfolio;
import com.gillianbc.goalplanner.model.Results;
import com.gillianbc.goalplanner.model.RiskProfile;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

import static com.gillianbc.goalplanner.service.Amounts.HUNDRED;
import static com.gillianbc.goalplanner.service.Amounts.MATH_CONTEXT;
import static com.gillianbc.goalplanner.service.Amounts.whole;

/**
 * Plain-language commentary on a calculated goal.
 * <p>
 * The template is chosen from the coverage band (same cut points as {@link HealthScorer}),
 * the difference between the required and the current monthly contribution, and the risk
 * profile. When income is known a note about the share of income this goal uses is appended.
 * Output is fully deterministic.
 */
@Service
public class ExplanationGenerator {

    // Inside the on-track band, contributing more than this above the requirement counts as overfunding
    private static final BigDecimal OVERFUNDING_MARGIN = BigDecimal.valueOf(-100);

    private final InputNormalizer normalizer;
    private final CurrencyFormatter currency;

    public ExplanationGenerator(InputNormalizer normalizer, CurrencyFormatter currency) {
        this.normalizer = normalizer;
        this.currency = currency;
    }

    /**
     * Explains a goal using the portfolio's risk profile and monthly income.
     */
    public String explain(GoalInput inputs, Results results, Portfolio portfolio) {
        Objects.requireNonNull(portfolio, "portfolio must not be null");
        return explain(inputs, results, portfolio.getRiskProfile(), normalizer.toNumber(portfolio.getMonthlyIncome()));
    }

    /**
     * @param inputs        the goal's raw inputs
     * @param results       the goal's computed results
     * @param riskProfile   portfolio risk profile
     * @param monthlyIncome normalized monthly income; null or non-positive omits the income note
     */
    public String explain(GoalInput inputs, Results results, RiskProfile riskProfile, BigDecimal monthlyIncome) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(results, "results must not be null");
        Objects.requireNonNull(riskProfile, "riskProfile must not be null");

        BigDecimal currentSip = normalizer.toNumber(inputs.getMonthlyContribution());
        BigDecimal coverage = results.getCoverage();
        BigDecimal sipDiff = results.getMonthlyRequired().subtract(currentSip);
        String risk = riskSentence(riskProfile);
        String incomeNote = incomeNote(currentSip, monthlyIncome);

        if (results.getEffectiveTarget().signum() <= 0) {
            return "You haven't really set a proper inflation-adjusted target yet. Define a realistic goal amount "
                    + "and duration so this planner can stop guessing and start actually helping you. " + risk;
        }

        if (coverage.compareTo(HealthScorer.VERY_WEAK_BELOW) < 0) {
            return "Right now, your plan is funding less than half of your inflation-adjusted target. Either increase "
                    + "your monthly contribution, extend the time horizon, or lower the goal. " + risk + incomeNote;
        }

        if (coverage.compareTo(HealthScorer.NEEDS_WORK_BELOW) < 0) {
            if (sipDiff.signum() > 0) {
                return "You're underfunded: your current SIP of " + currency.format(currentSip)
                        + " gets you partially there, but you need around " + currency.format(whole(sipDiff))
                        + " more per month to fully cover this inflation-adjusted goal. " + risk + incomeNote;
            }
            return "Your plan is underfunded but not hopeless. A mix of slightly higher SIPs, a longer duration, or "
                    + "trimming the goal amount can push this into the \"on track\" zone. " + risk + incomeNote;
        }

        if (coverage.compareTo(HealthScorer.ALMOST_THERE_BELOW) < 0) {
            if (sipDiff.signum() > 0) {
                return "You're close to the finish line. Increase your monthly SIP by about "
                        + currency.format(whole(sipDiff))
                        + " or extend the duration a bit to comfortably meet the inflation-adjusted target. "
                        + risk + incomeNote;
            }
            return "This plan is almost hitting your inflation-adjusted target. Stay consistent and don't panic-sell "
                    + "during market dips. " + risk + incomeNote;
        }

        if (coverage.compareTo(HealthScorer.ON_TRACK_BELOW) < 0) {
            if (sipDiff.compareTo(OVERFUNDING_MARGIN) < 0) {
                return "You're comfortably on track and maybe even slightly overfunding this goal. You could reduce "
                        + "your SIP or redirect some surplus towards another goal. " + risk + incomeNote;
            }
            return "You're on track to meet this goal. Just keep the SIP going and avoid impulsive changes. "
                    + risk + incomeNote;
        }

        return "You're massively overfunding this goal relative to the inflation-adjusted target. You can afford to "
                + "lower this SIP a bit and redirect money towards other goals (or your sanity). " + risk + incomeNote;
    }

    static String riskSentence(RiskProfile riskProfile) {
        return switch (riskProfile) {
            case CONSERVATIVE -> "You're using a conservative profile, which prioritises stability over high returns.";
            case MODERATE -> "You're using a moderate profile, which balances risk and growth.";
            case AGGRESSIVE -> "You're using an aggressive profile, which relies on higher market returns and more volatility.";
        };
    }

    private static String incomeNote(BigDecimal currentSip, BigDecimal monthlyIncome) {
        if (monthlyIncome == null || monthlyIncome.signum() <= 0) {
            return "";
        }
        BigDecimal pct = currentSip.divide(monthlyIncome, MATH_CONTEXT).multiply(HUNDRED, MATH_CONTEXT)
                .setScale(1, RoundingMode.HALF_UP);
        return " This single goal currently uses about " + pct.toPlainString() + "% of your monthly income.";
    }
}
