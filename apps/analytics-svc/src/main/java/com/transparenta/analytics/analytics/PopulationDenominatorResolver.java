package com.transparenta.analytics.analytics;

import com.transparenta.analytics.model.AnalyticsFilter;
import com.transparenta.analytics.repository.EntityTerritory;
import com.transparenta.analytics.repository.PopulationRepository;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes the population a per-capita figure is divided by.
 *
 * <p>Without an entity scope the whole country counts. Otherwise every matched entity is
 * classified as COUNTY (a county council), UAT (mapped to a territorial unit) or COUNTRY (no
 * territorial mapping). Any COUNTRY unit widens the denominator to the national population;
 * otherwise the populations of the distinct counties are summed together with the distinct UATs
 * that lie outside those counties, so no person is counted twice.
 */
@Component
public class PopulationDenominatorResolver {
    private static final Logger log = LoggerFactory.getLogger(PopulationDenominatorResolver.class);

    static final String COUNTY_COUNCIL_TYPE = "admin_county_council";

    private final PopulationRepository populationRepository;

    public PopulationDenominatorResolver(PopulationRepository populationRepository) {
        this.populationRepository = populationRepository;
    }

    public long resolve(AnalyticsFilter filter) {
        if (!filter.hasEntityScope()) {
            return populationRepository.countryPopulation();
        }
        List<EntityTerritory> entities = populationRepository.findEntityTerritories(filter);
        if (entities.isEmpty()) {
            log.warn("No entities matched the population scope; per-capita amounts will not be scaled");
            return 0L;
        }

        Set<String> counties = new LinkedHashSet<>();
        Map<Integer, PopulationUnit> uats = new LinkedHashMap<>();
        for (EntityTerritory entity : entities) {
            PopulationUnit unit = classify(entity);
            switch (unit.scope()) {
                case COUNTRY -> {
                    log.debug("Entity {} has no territorial mapping; using national population", entity.cui());
                    return populationRepository.countryPopulation();
                }
                case COUNTY -> counties.add(unit.countyCode());
                case UAT -> uats.putIfAbsent(unit.uatId(), unit);
            }
        }

        long total = 0L;
        if (!counties.isEmpty()) {
            for (Long population : populationRepository.countyPopulations(counties).values()) {
                total += population != null ? population : 0L;
            }
        }
        for (PopulationUnit uat : uats.values()) {
            if (uat.countyCode() == null || !counties.contains(uat.countyCode())) {
                total += uat.population();
            }
        }
        return total;
    }

    PopulationUnit classify(EntityTerritory entity) {
        if (COUNTY_COUNCIL_TYPE.equals(entity.entityType()) && entity.countyCode() != null) {
            return PopulationUnit.county(entity.countyCode());
        }
        if (entity.uatId() != null) {
            long population = entity.uatPopulation() != null ? entity.uatPopulation() : 0L;
            return PopulationUnit.uat(entity.uatId(), entity.countyCode(), population);
        }
        return PopulationUnit.country();
    }
}
