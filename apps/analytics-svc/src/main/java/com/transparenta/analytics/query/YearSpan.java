package com.transparenta.analytics.query;

public record YearSpan(int startYear, int endYear) {
}
