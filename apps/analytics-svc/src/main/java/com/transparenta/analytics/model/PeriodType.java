package com.transparenta.analytics.model;

public enum PeriodType {
    YEAR,
    QUARTER,
    MONTH
}
