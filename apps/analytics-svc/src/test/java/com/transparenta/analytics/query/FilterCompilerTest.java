package com.transparenta.analytics.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.transparenta.analytics.exception.InvalidFilterException;
import com.transparenta.analytics.model.AccountCategory;
import com.transparenta.analytics.model.AnalyticsFilter;
import com.transparenta.analytics.model.NormalizationMode;
import com.transparenta.analytics.model.PeriodType;
import com.transparenta.analytics.model.ReportPeriod;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class FilterCompilerTest {

    private final FilterCompiler compiler = new FilterCompiler(new PeriodResolver());

    @Test
    void minimalFilterNeedsNoJoins() {
        CompiledFilter compiled = compiler.compile(AnalyticsFilter.builder(AccountCategory.EXPENSE, ReportPeriod.year(2023)).build());

        assertThat(compiled.wherePredicates()).containsExactly(
                "eli.is_yearly = TRUE",
                "eli.year = :p1",
                "eli.account_category = :p2");
        assertThat(compiled.parameters()).containsEntry("p2", "ch");
        assertThat(compiled.joins()).isEqualTo(JoinRequirements.NONE);
        assertThat(compiled.havingPredicates()).isEmpty();
        assertThat(compiled.amountColumn()).isEqualTo("ytd_amount");
    }

    @Test
    void valuesAreBoundNeverInlined() {
        AnalyticsFilter filter = AnalyticsFilter.builder(AccountCategory.REVENUE, ReportPeriod.year(2023))
                .entityCuis("4267117'; DROP TABLE Entities; --")
                .search("Cluj")
                .build();

        CompiledFilter compiled = compiler.compile(filter);

        assertThat(String.join(" ", compiled.wherePredicates())).doesNotContain("DROP TABLE").doesNotContain("Cluj");
        assertThat(compiled.parameters().values()).contains(List.of("4267117'; DROP TABLE Entities; --"), "%Cluj%");
    }

    @Test
    void prefixesCompileToLikeDisjunctions() {
        AnalyticsFilter filter = AnalyticsFilter.builder(AccountCategory.EXPENSE, ReportPeriod.year(2023))
                .functionalPrefixes("65.", "66.")
                .exclude(AnalyticsFilter.Exclusions.builder().functionalPrefixes("70.").build())
                .build();

        CompiledFilter compiled = compiler.compile(filter);

        assertThat(compiled.wherePredicates()).contains(
                "(eli.functional_code LIKE :p3 OR eli.functional_code LIKE :p4)",
                "(eli.functional_code IS NULL OR NOT (eli.functional_code LIKE :p5))");
        assertThat(compiled.parameters())
                .containsEntry("p3", "65.%")
                .containsEntry("p4", "66.%")
                .containsEntry("p5", "70.%");
    }

    @Test
    void itemThresholdsUseThePeriodAmountColumn() {
        AnalyticsFilter filter = AnalyticsFilter.builder(AccountCategory.EXPENSE,
                        ReportPeriod.interval(PeriodType.QUARTER, "2023-Q1", "2023-Q2"))
                .itemMinAmount(new BigDecimal("1000"))
                .build();

        CompiledFilter compiled = compiler.compile(filter);

        assertThat(compiled.wherePredicates()).anyMatch(p -> p.startsWith("eli.quarterly_amount >= :p"));
    }

    @Test
    void aggregateThresholdsBecomeHavingInTotalMode() {
        AnalyticsFilter filter = AnalyticsFilter.builder(AccountCategory.EXPENSE, ReportPeriod.year(2023))
                .aggregateMinAmount(new BigDecimal("10"))
                .aggregateMaxAmount(new BigDecimal("99"))
                .build();

        CompiledFilter compiled = compiler.compile(filter);

        assertThat(compiled.aggregateThresholdsDeferred()).isFalse();
        assertThat(compiled.havingClause())
                .isEqualTo("HAVING COALESCE(SUM(eli.ytd_amount), 0) >= :p3 AND COALESCE(SUM(eli.ytd_amount), 0) <= :p4");
    }

    @Test
    void aggregateThresholdsAreDeferredForCurrencyModes() {
        AnalyticsFilter filter = AnalyticsFilter.builder(AccountCategory.EXPENSE, ReportPeriod.year(2023))
                .aggregateMinAmount(new BigDecimal("10"))
                .normalization(NormalizationMode.TOTAL_CURRENCY)
                .build();

        CompiledFilter compiled = compiler.compile(filter);

        assertThat(compiled.aggregateThresholdsDeferred()).isTrue();
        assertThat(compiled.havingPredicates()).isEmpty();
    }

    @Test
    void territorialFieldsRequireBothJoins() {
        AnalyticsFilter filter = AnalyticsFilter.builder(AccountCategory.EXPENSE, ReportPeriod.year(2023))
                .countyCodes("CJ")
                .minPopulation(20_000L)
                .build();

        CompiledFilter compiled = compiler.compile(filter);

        assertThat(compiled.joins()).isEqualTo(new JoinRequirements(true, true));
        assertThat(compiled.wherePredicates()).contains("u.county_code IN (:p3)", "COALESCE(u.population, 0) >= :p4");
    }

    @Test
    void entityFieldsRequireOnlyTheEntityJoin() {
        AnalyticsFilter filter = AnalyticsFilter.builder(AccountCategory.EXPENSE, ReportPeriod.year(2023))
                .isUat(true)
                .entityTypes("admin_comuna")
                .build();

        CompiledFilter compiled = compiler.compile(filter);

        assertThat(compiled.joins()).isEqualTo(new JoinRequirements(true, false));
        assertThat(compiled.wherePredicates()).contains("e.entity_type IN (:p3)", "e.is_uat = :p4");
    }

    @Test
    void predicateOrderIsStable() {
        AnalyticsFilter filter = AnalyticsFilter.builder(AccountCategory.EXPENSE, ReportPeriod.year(2023))
                .countyCodes("B")
                .economicCodes("10.01.01")
                .itemMaxAmount(BigDecimal.TEN)
                .exclude(AnalyticsFilter.Exclusions.builder().entityCuis("1").build())
                .build();

        CompiledFilter first = compiler.compile(filter);
        CompiledFilter second = compiler.compile(filter);

        assertThat(first).isEqualTo(second);
        List<String> predicates = first.wherePredicates();
        assertThat(predicates.indexOf("eli.economic_code IN (:p3)"))
                .isLessThan(predicates.indexOf("(eli.entity_cui IS NULL OR eli.entity_cui NOT IN (:p4))"));
        assertThat(predicates.get(predicates.size() - 1)).isEqualTo("u.county_code IN (:p6)");
    }

    @Test
    void escapesLikeWildcardsInPrefixes() {
        assertThat(FilterCompiler.escapeLike("65_%")).isEqualTo("65\\_\\%");
    }

    @Test
    void rejectsMissingRequiredFields() {
        assertThatThrownBy(() -> compiler.compile(AnalyticsFilter.builder().accountCategory(AccountCategory.EXPENSE).build()))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("reportPeriod");
        assertThatThrownBy(() -> compiler.compile(AnalyticsFilter.builder().reportPeriod(ReportPeriod.year(2023)).build()))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("accountCategory");
    }
}
