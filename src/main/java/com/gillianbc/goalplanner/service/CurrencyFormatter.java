package com.gillianbc.goalplanner.service;

import com.ibm.icu.text.NumberFormat;
import com.ibm.icu.util.ULocale;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Renders amounts as whole rupees with Indian digit grouping, e.g. "₹12,500" or "₹19,14,422".
 */
@Component
public class CurrencyFormatter {

    public static final String SYMBOL = "₹";

    private static final ULocale INDIA = new ULocale("en_IN");

    public String format(BigDecimal amount) {
        // NumberFormat is not thread-safe, so one per call
        NumberFormat format = NumberFormat.getNumberInstance(INDIA);
        format.setMaximumFractionDigits(0);
        format.setRoundingMode(com.ibm.icu.math.BigDecimal.ROUND_HALF_UP);
        return SYMBOL + format.format(amount);
    }
}
