package com.transparenta.analytics.query;

import com.transparenta.analytics.exception.InvalidFilterException;
import com.transparenta.analytics.model.AnalyticsFilter;
import com.transparenta.analytics.model.AnalyticsFilter.Exclusions;
import com.transparenta.analytics.model.PeriodType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Compiles an {@link AnalyticsFilter} into parameterized SQL fragments over
 * {@code ExecutionLineItems eli}, optionally joined with {@code Entities e} and
 * {@code UATs u}. Predicates are emitted in a fixed order so that equal filters produce equal
 * SQL.
 */
@Component
public class FilterCompiler {

    public static final String LINE_ITEM_ALIAS = "eli";
    public static final String ENTITY_ALIAS = "e";
    public static final String UAT_ALIAS = "u";

    private final PeriodResolver periodResolver;

    public FilterCompiler(PeriodResolver periodResolver) {
        this.periodResolver = periodResolver;
    }

    public void validate(AnalyticsFilter filter) {
        if (filter == null) {
            throw new InvalidFilterException("filter must be provided");
        }
        if (filter.reportPeriod() == null) {
            throw new InvalidFilterException("reportPeriod is required for analytics");
        }
        if (filter.accountCategory() == null) {
            throw new InvalidFilterException("accountCategory is required for analytics");
        }
        if (filter.minPopulation() != null && filter.maxPopulation() != null
                && filter.minPopulation() > filter.maxPopulation()) {
            throw new InvalidFilterException("minPopulation must not exceed maxPopulation");
        }
    }

    public CompiledFilter compile(AnalyticsFilter filter) {
        validate(filter);
        SqlConditions c = new SqlConditions();
        PeriodType periodType = filter.reportPeriod().type();

        periodResolver.apply(filter.reportPeriod(), LINE_ITEM_ALIAS, c);
        c.add("eli.account_category = " + c.bind(filter.accountCategory().code()));
        addLineItemPredicates(filter, c);
        addExclusions(filter.exclude(), c);
        addItemThresholds(filter, periodType, c);

        JoinRequirements joins = JoinAnalyzer.analyze(filter);
        if (joins.needsEntityJoin()) {
            addEntityPredicates(filter, c);
        }
        if (joins.needsTerritorialJoin()) {
            addTerritorialPredicates(filter, c);
        }

        boolean deferred = filter.normalization().requiresCurrencyConversion();
        List<String> having = new ArrayList<>();
        if (!deferred) {
            String sum = AmountColumns.sumExpression(periodType, LINE_ITEM_ALIAS);
            if (filter.aggregateMinAmount() != null) {
                having.add(sum + " >= " + c.bind(filter.aggregateMinAmount()));
            }
            if (filter.aggregateMaxAmount() != null) {
                having.add(sum + " <= " + c.bind(filter.aggregateMaxAmount()));
            }
        }
        return new CompiledFilter(c.predicates(), having, c.parameters(), joins, periodType, deferred);
    }

    private void addLineItemPredicates(AnalyticsFilter f, SqlConditions c) {
        in(c, "eli.report_id", f.reportIds());
        if (f.reportType() != null && !f.reportType().isBlank()) {
            c.add("eli.report_type = " + c.bind(f.reportType()));
        }
        if (f.mainCreditorCui() != null && !f.mainCreditorCui().isBlank()) {
            c.add("eli.main_creditor_cui = " + c.bind(f.mainCreditorCui()));
        }
        in(c, "eli.entity_cui", f.entityCuis());
        in(c, "eli.functional_code", f.functionalCodes());
        prefixes(c, "eli.functional_code", f.functionalPrefixes(), false);
        in(c, "eli.economic_code", f.economicCodes());
        prefixes(c, "eli.economic_code", f.economicPrefixes(), false);
        in(c, "eli.funding_source_id", f.fundingSourceIds());
        in(c, "eli.budget_sector_id", f.budgetSectorIds());
        in(c, "eli.program_code", f.programCodes());
        in(c, "eli.expense_type", f.expenseTypes());
    }

    private void addExclusions(Exclusions ex, SqlConditions c) {
        notIn(c, "eli.report_id", ex.reportIds());
        notIn(c, "eli.entity_cui", ex.entityCuis());
        if (ex.mainCreditorCui() != null && !ex.mainCreditorCui().isBlank()) {
            c.add("eli.main_creditor_cui IS DISTINCT FROM " + c.bind(ex.mainCreditorCui()));
        }
        notIn(c, "eli.functional_code", ex.functionalCodes());
        prefixes(c, "eli.functional_code", ex.functionalPrefixes(), true);
        notIn(c, "eli.economic_code", ex.economicCodes());
        prefixes(c, "eli.economic_code", ex.economicPrefixes(), true);
        notIn(c, "eli.funding_source_id", ex.fundingSourceIds());
        notIn(c, "eli.budget_sector_id", ex.budgetSectorIds());
        notIn(c, "eli.program_code", ex.programCodes());
        notIn(c, "eli.expense_type", ex.expenseTypes());
    }

    private void addItemThresholds(AnalyticsFilter f, PeriodType type, SqlConditions c) {
        String column = AmountColumns.qualified(type, LINE_ITEM_ALIAS);
        BigDecimal min = f.itemMinAmount();
        BigDecimal max = f.itemMaxAmount();
        if (min != null) {
            c.add(column + " >= " + c.bind(min));
        }
        if (max != null) {
            c.add(column + " <= " + c.bind(max));
        }
    }

    private void addEntityPredicates(AnalyticsFilter f, SqlConditions c) {
        in(c, "e.entity_type", f.entityTypes());
        if (f.isUat() != null) {
            c.add("e.is_uat = " + c.bind(f.isUat()));
        }
        in(c, "e.uat_id", f.uatIds());
        if (f.search() != null) {
            c.add("e.name ILIKE " + c.bind("%" + escapeLike(f.search()) + "%"));
        }
        Exclusions ex = f.exclude();
        notIn(c, "e.entity_type", ex.entityTypes());
        notIn(c, "e.uat_id", ex.uatIds());
        if (ex.search() != null) {
            c.add("e.name NOT ILIKE " + c.bind("%" + escapeLike(ex.search()) + "%"));
        }
    }

    private void addTerritorialPredicates(AnalyticsFilter f, SqlConditions c) {
        in(c, "u.county_code", f.countyCodes());
        if (f.minPopulation() != null) {
            c.add("COALESCE(u.population, 0) >= " + c.bind(f.minPopulation()));
        }
        if (f.maxPopulation() != null) {
            c.add("COALESCE(u.population, 0) <= " + c.bind(f.maxPopulation()));
        }
        Exclusions ex = f.exclude();
        notIn(c, "u.county_code", ex.countyCodes());
        notIn(c, "u.region", ex.regions());
    }

    private static void in(SqlConditions c, String column, List<?> values) {
        if (!values.isEmpty()) {
            c.add(column + " IN (" + c.bind(values) + ")");
        }
    }

    private static void notIn(SqlConditions c, String column, List<?> values) {
        if (!values.isEmpty()) {
            c.add("(" + column + " IS NULL OR " + column + " NOT IN (" + c.bind(values) + "))");
        }
    }

    private static void prefixes(SqlConditions c, String column, List<String> values, boolean negate) {
        if (values.isEmpty()) {
            return;
        }
        List<String> likes = new ArrayList<>(values.size());
        for (String prefix : values) {
            likes.add(column + " LIKE " + c.bind(escapeLike(prefix) + "%"));
        }
        String disjunction = "(" + String.join(" OR ", likes) + ")";
        c.add(negate ? "(" + column + " IS NULL OR NOT " + disjunction + ")" : disjunction);
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
