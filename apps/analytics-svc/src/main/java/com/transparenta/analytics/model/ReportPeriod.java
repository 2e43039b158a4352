package com.transparenta.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.transparenta.analytics.exception.InvalidPeriodException;
import java.util.Arrays;
import java.util.List;

/**
 * Reporting period of a filter: a granularity plus either a closed interval or an explicit
 * list of period labels ({@code 2023}, {@code 2023-04}, {@code 2023-Q2}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportPeriod(PeriodType type, Interval interval, List<String> dates) {

    public ReportPeriod {
        if (type == null) {
            throw new InvalidPeriodException("period type must be provided");
        }
        boolean hasInterval = interval != null;
        boolean hasDates = dates != null;
        if (hasInterval == hasDates) {
            throw new InvalidPeriodException("exactly one of interval or dates must be set");
        }
        if (hasDates) {
            if (dates.isEmpty()) {
                throw new InvalidPeriodException("dates selection must not be empty");
            }
            dates = List.copyOf(dates);
        }
    }

    public static ReportPeriod year(int year) {
        return interval(PeriodType.YEAR, String.valueOf(year), String.valueOf(year));
    }

    public static ReportPeriod years(int startYear, int endYear) {
        return interval(PeriodType.YEAR, String.valueOf(startYear), String.valueOf(endYear));
    }

    public static ReportPeriod interval(PeriodType type, String start, String end) {
        return new ReportPeriod(type, new Interval(start, end), null);
    }

    public static ReportPeriod dates(PeriodType type, String... dates) {
        return new ReportPeriod(type, null, Arrays.asList(dates));
    }

    public record Interval(String start, String end) {
        public Interval {
            if (start == null || start.isBlank() || end == null || end.isBlank()) {
                throw new InvalidPeriodException("interval start and end must be provided");
            }
        }
    }
}
