package com.transparenta.analytics.analytics;

/**
 * Territorial unit an entity contributes to the per-capita denominator.
 * {@code countyCode} is set for COUNTY and UAT units; {@code uatId} and {@code population}
 * only for UAT units.
 */
public record PopulationUnit(PopulationScope scope, String countyCode, Integer uatId, long population) {

    public PopulationUnit {
        if (scope == null) {
            throw new IllegalArgumentException("scope must be provided");
        }
    }

    public static PopulationUnit country() {
        return new PopulationUnit(PopulationScope.COUNTRY, null, null, 0L);
    }

    public static PopulationUnit county(String countyCode) {
        return new PopulationUnit(PopulationScope.COUNTY, countyCode, null, 0L);
    }

    public static PopulationUnit uat(int uatId, String countyCode, long population) {
        return new PopulationUnit(PopulationScope.UAT, countyCode, uatId, population);
    }
}
