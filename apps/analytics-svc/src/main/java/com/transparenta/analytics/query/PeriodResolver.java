package com.transparenta.analytics.query;

import com.transparenta.analytics.exception.InvalidPeriodException;
import com.transparenta.analytics.model.PeriodType;
import com.transparenta.analytics.model.ReportPeriod;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link ReportPeriod} into predicates over the {@code year}, {@code month} and
 * {@code quarter} columns of the line-item table, plus the bucket flag that keeps yearly and
 * quarterly snapshots from being summed together with monthly rows.
 */
@Component
public class PeriodResolver {

    private static final Pattern YEAR_LABEL = Pattern.compile("^(\\d{4})$");
    private static final Pattern MONTH_LABEL = Pattern.compile("^(\\d{4})-(0[1-9]|1[0-2])$");
    private static final Pattern QUARTER_LABEL = Pattern.compile("^(\\d{4})-Q([1-4])$");

    public ParsedPeriod parse(String label, PeriodType type) {
        if (label == null) {
            throw new InvalidPeriodException("period label must be provided");
        }
        String trimmed = label.trim();
        Matcher matcher = switch (type) {
            case YEAR -> YEAR_LABEL.matcher(trimmed);
            case MONTH -> MONTH_LABEL.matcher(trimmed);
            case QUARTER -> QUARTER_LABEL.matcher(trimmed);
        };
        if (!matcher.matches()) {
            throw new InvalidPeriodException("Invalid " + type.name().toLowerCase(Locale.ROOT) + " period label: '" + label + "'");
        }
        int year = Integer.parseInt(matcher.group(1));
        int sub = type == PeriodType.YEAR ? 0 : Integer.parseInt(matcher.group(2));
        return new ParsedPeriod(year, sub);
    }

    /**
     * Adds the bucket flag and the period predicates for {@code period} to {@code conditions}.
     * Every label is validated before anything is added.
     */
    public void apply(ReportPeriod period, String alias, SqlConditions conditions) {
        PeriodType type = period.type();
        List<String> predicates = new ArrayList<>();
        if (period.interval() != null) {
            ParsedPeriod start = parse(period.interval().start(), type);
            ParsedPeriod end = parse(period.interval().end(), type);
            if (start.compareTo(end) > 0) {
                throw new InvalidPeriodException("Period start " + period.interval().start()
                        + " is after end " + period.interval().end());
            }
            String flag = bucketFlag(type, alias);
            if (flag != null) {
                conditions.add(flag);
            }
            if (start.equals(end)) {
                conditions.add(equality(type, alias, start, conditions));
            } else if (type == PeriodType.YEAR) {
                conditions.add(alias + ".year BETWEEN " + conditions.bind(start.year()) + " AND " + conditions.bind(end.year()));
            } else {
                String tuple = "(" + alias + ".year, " + alias + "." + subColumn(type) + ")";
                conditions.add(tuple + " >= (" + conditions.bind(start.year()) + ", " + conditions.bind(start.subPeriod()) + ")");
                conditions.add(tuple + " <= (" + conditions.bind(end.year()) + ", " + conditions.bind(end.subPeriod()) + ")");
            }
            return;
        }

        Set<ParsedPeriod> selected = new LinkedHashSet<>();
        for (String label : period.dates()) {
            selected.add(parse(label, type));
        }
        String flag = bucketFlag(type, alias);
        if (flag != null) {
            conditions.add(flag);
        }
        for (ParsedPeriod p : selected) {
            predicates.add(equality(type, alias, p, conditions));
        }
        conditions.add(predicates.size() == 1 ? predicates.get(0) : "(" + String.join(" OR ", predicates) + ")");
    }

    /**
     * Calendar years touched by the period; used to pick conversion rates.
     */
    public YearSpan yearSpan(ReportPeriod period) {
        if (period.interval() != null) {
            ParsedPeriod start = parse(period.interval().start(), period.type());
            ParsedPeriod end = parse(period.interval().end(), period.type());
            return new YearSpan(start.year(), end.year());
        }
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (String label : period.dates()) {
            int year = parse(label, period.type()).year();
            min = Math.min(min, year);
            max = Math.max(max, year);
        }
        return new YearSpan(min, max);
    }

    private String equality(PeriodType type, String alias, ParsedPeriod p, SqlConditions conditions) {
        if (type == PeriodType.YEAR) {
            return alias + ".year = " + conditions.bind(p.year());
        }
        return "(" + alias + ".year = " + conditions.bind(p.year()) + " AND "
                + alias + "." + subColumn(type) + " = " + conditions.bind(p.subPeriod()) + ")";
    }

    private static String bucketFlag(PeriodType type, String alias) {
        return switch (type) {
            case YEAR -> alias + ".is_yearly = TRUE";
            case QUARTER -> alias + ".is_quarterly = TRUE";
            case MONTH -> null;
        };
    }

    private static String subColumn(PeriodType type) {
        return type == PeriodType.QUARTER ? "quarter" : "month";
    }
}
