package com.transparenta.analytics.repository;

import com.transparenta.analytics.model.AggregatedRow;
import com.transparenta.analytics.query.AmountColumns;
import com.transparenta.analytics.query.CompiledFilter;
import com.transparenta.analytics.query.FilterCompiler;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcLineItemAggregationStore implements LineItemAggregationStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcLineItemAggregationStore.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcLineItemAggregationStore(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<AggregatedRow> fetchGroups(AggregationQuery query) {
        CompiledFilter filter = query.filter();
        MapSqlParameterSource params = new MapSqlParameterSource(filter.parameters());
        StringBuilder sql = new StringBuilder(baseQuery(filter, query.perYear()));
        if (!query.perYear()) {
            sql.append("ORDER BY amount DESC, functional_code, economic_code\n");
            if (query.limit() != null) {
                sql.append("LIMIT :limit\n");
                params.addValue("limit", query.limit());
            }
            if (query.offset() > 0) {
                sql.append("OFFSET :offset\n");
                params.addValue("offset", query.offset());
            }
        }
        log.debug("Aggregating line items (perYear={}, joins={})", query.perYear(), filter.joins());
        boolean perYear = query.perYear();
        return jdbcTemplate.query(sql.toString(), params, (rs, rowNum) -> mapRow(rs, perYear));
    }

    @Override
    public int countGroups(CompiledFilter filter) {
        String sql = "SELECT COUNT(*) FROM (\n" + baseQuery(filter, false) + ") agg_count";
        Long count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(filter.parameters()), Long.class);
        return count == null ? 0 : Math.toIntExact(count);
    }

    String baseQuery(CompiledFilter filter, boolean perYear) {
        String amount = AmountColumns.sumExpression(filter.periodType(), FilterCompiler.LINE_ITEM_ALIAS);
        StringBuilder sql = new StringBuilder();
        sql.append("""
                SELECT eli.functional_code,
                       fc.functional_name,
                       COALESCE(eli.economic_code, '%s') AS economic_code,
                       COALESCE(ec.economic_name, '%s') AS economic_name,
                """.formatted(AggregatedRow.UNKNOWN_ECONOMIC_CODE, AggregatedRow.UNKNOWN_ECONOMIC_NAME));
        if (perYear) {
            sql.append("       eli.year,\n");
        }
        sql.append("       ").append(amount).append(" AS amount,\n");
        sql.append("""
                       COUNT(*) AS count
                FROM ExecutionLineItems eli
                JOIN FunctionalClassifications fc ON eli.functional_code = fc.functional_code
                LEFT JOIN EconomicClassifications ec ON eli.economic_code = ec.economic_code
                """);
        if (filter.joins().needsEntityJoin()) {
            sql.append("JOIN Entities e ON eli.entity_cui = e.cui\n");
        }
        if (filter.joins().needsTerritorialJoin()) {
            sql.append("LEFT JOIN UATs u ON (u.id = e.uat_id) OR (u.uat_code = e.cui)\n");
        }
        String where = filter.whereClause();
        if (!where.isEmpty()) {
            sql.append(where).append('\n');
        }
        sql.append("GROUP BY eli.functional_code, fc.functional_name, COALESCE(eli.economic_code, '")
                .append(AggregatedRow.UNKNOWN_ECONOMIC_CODE)
                .append("'), COALESCE(ec.economic_name, '")
                .append(AggregatedRow.UNKNOWN_ECONOMIC_NAME)
                .append("')");
        if (perYear) {
            sql.append(", eli.year");
        }
        sql.append('\n');
        if (!perYear) {
            String having = filter.havingClause();
            if (!having.isEmpty()) {
                sql.append(having).append('\n');
            }
        }
        return sql.toString();
    }

    private AggregatedRow mapRow(ResultSet rs, boolean perYear) throws SQLException {
        return new AggregatedRow(
                rs.getString("functional_code"),
                rs.getString("functional_name"),
                rs.getString("economic_code"),
                rs.getString("economic_name"),
                rs.getBigDecimal("amount"),
                rs.getLong("count"),
                perYear ? rs.getInt("year") : null
        );
    }
}
