package com.transparenta.analytics.analytics;

public enum PopulationScope {
    COUNTRY,
    COUNTY,
    UAT
}
