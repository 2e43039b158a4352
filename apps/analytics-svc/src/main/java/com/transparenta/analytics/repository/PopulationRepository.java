package com.transparenta.analytics.repository;

import com.transparenta.analytics.model.AnalyticsFilter;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface PopulationRepository {

    long countryPopulation();

    /**
     * County population keyed by county code; codes without a county-level row are absent.
     */
    Map<String, Long> countyPopulations(Collection<String> countyCodes);

    /**
     * Entities matched by the entity-scoping dimensions of {@code filter}, one row per entity.
     */
    List<EntityTerritory> findEntityTerritories(AnalyticsFilter filter);
}
