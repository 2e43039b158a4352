package com.transparenta.analytics.repository;

/**
 * An entity with its territorial mapping; the UAT columns are null when no UAT matched.
 */
public record EntityTerritory(
        String cui,
        String entityType,
        boolean isUat,
        Integer uatId,
        String countyCode,
        Long uatPopulation
) {
}
