package com.transparenta.analytics.query;

/**
 * A period label split into its year and, for month/quarter granularity, the sub-period
 * (month 1-12 or quarter 1-4; 0 for yearly labels).
 */
public record ParsedPeriod(int year, int subPeriod) implements Comparable<ParsedPeriod> {

    @Override
    public int compareTo(ParsedPeriod other) {
        int byYear = Integer.compare(year, other.year);
        return byYear != 0 ? byYear : Integer.compare(subPeriod, other.subPeriod);
    }
}
