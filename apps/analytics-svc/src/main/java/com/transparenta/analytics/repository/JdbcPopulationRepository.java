package com.transparenta.analytics.repository;

import com.transparenta.analytics.model.AnalyticsFilter;
import com.transparenta.analytics.query.SqlConditions;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcPopulationRepository implements PopulationRepository {

    // The county seat row carries the county population; Bucharest (B) is keyed by its own SIRUTA code.
    private static final String COUNTY_POPULATION_EXPR = """
            MAX(CASE
                    WHEN county_code = 'B' AND siruta_code = '179132' THEN population
                    WHEN siruta_code = county_code THEN population
                    ELSE 0
                END)""";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcPopulationRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long countryPopulation() {
        String sql = """
                SELECT COALESCE(SUM(county_population), 0) AS population
                FROM (
                    SELECT county_code, %s AS county_population
                    FROM UATs
                    GROUP BY county_code
                ) cp
                """.formatted(COUNTY_POPULATION_EXPR);
        Long population = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Long.class);
        return population == null ? 0L : population;
    }

    @Override
    public Map<String, Long> countyPopulations(Collection<String> countyCodes) {
        if (countyCodes == null || countyCodes.isEmpty()) {
            return Map.of();
        }
        String sql = """
                SELECT county_code, %s AS county_population
                FROM UATs
                WHERE county_code IN (:countyCodes)
                GROUP BY county_code
                """.formatted(COUNTY_POPULATION_EXPR);
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("countyCodes", List.copyOf(countyCodes));
        Map<String, Long> result = new LinkedHashMap<>();
        jdbcTemplate.query(sql, params, (RowCallbackHandler) rs ->
                result.put(rs.getString("county_code"), rs.getLong("county_population")));
        return result;
    }

    @Override
    public List<EntityTerritory> findEntityTerritories(AnalyticsFilter filter) {
        SqlConditions c = new SqlConditions();
        if (!filter.entityCuis().isEmpty()) {
            c.add("e.cui IN (" + c.bind(filter.entityCuis()) + ")");
        }
        if (!filter.entityTypes().isEmpty()) {
            c.add("e.entity_type IN (" + c.bind(filter.entityTypes()) + ")");
        }
        if (filter.isUat() != null) {
            c.add("e.is_uat = " + c.bind(filter.isUat()));
        }
        if (!filter.uatIds().isEmpty()) {
            c.add("e.uat_id IN (" + c.bind(filter.uatIds()) + ")");
        }
        if (!filter.countyCodes().isEmpty()) {
            c.add("u.county_code IN (" + c.bind(filter.countyCodes()) + ")");
        }
        StringBuilder sql = new StringBuilder("""
                SELECT DISTINCT ON (e.cui)
                       e.cui,
                       e.entity_type,
                       COALESCE(e.is_uat, FALSE) AS is_uat,
                       u.id AS uat_id,
                       u.county_code,
                       u.population
                FROM Entities e
                LEFT JOIN UATs u ON (u.id = e.uat_id) OR (u.uat_code = e.cui)
                """);
        if (!c.isEmpty()) {
            sql.append(c.whereClause()).append('\n');
        }
        sql.append("ORDER BY e.cui, u.id\n");
        return jdbcTemplate.query(sql.toString(), new MapSqlParameterSource(c.parameters()), this::mapTerritory);
    }

    private EntityTerritory mapTerritory(ResultSet rs, int rowNum) throws SQLException {
        int uatId = rs.getInt("uat_id");
        Integer resolvedUatId = rs.wasNull() ? null : uatId;
        long population = rs.getLong("population");
        Long resolvedPopulation = rs.wasNull() ? null : population;
        return new EntityTerritory(
                rs.getString("cui"),
                rs.getString("entity_type"),
                rs.getBoolean("is_uat"),
                resolvedUatId,
                rs.getString("county_code"),
                resolvedPopulation
        );
    }
}
