package com.transparenta.analytics.query;

import com.transparenta.analytics.model.PeriodType;

/**
 * Monthly and quarterly rows keep their own amount columns next to the year-to-date amount.
 */
public final class AmountColumns {

    private AmountColumns() {
    }

    public static String itemColumn(PeriodType type) {
        return switch (type) {
            case YEAR -> "ytd_amount";
            case QUARTER -> "quarterly_amount";
            case MONTH -> "monthly_amount";
        };
    }

    public static String qualified(PeriodType type, String alias) {
        return alias + "." + itemColumn(type);
    }

    public static String sumExpression(PeriodType type, String alias) {
        return "COALESCE(SUM(" + qualified(type, alias) + "), 0)";
    }
}
