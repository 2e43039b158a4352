package com.transparenta.analytics.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class AnalyticsFilterTest {

    @Test
    void nullListsBecomeEmptyAndBlankSearchIsDropped() {
        AnalyticsFilter filter = AnalyticsFilter.builder(AccountCategory.REVENUE, ReportPeriod.year(2022))
                .search("   ")
                .build();

        assertThat(filter.entityCuis()).isEmpty();
        assertThat(filter.search()).isNull();
        assertThat(filter.exclude()).isEqualTo(AnalyticsFilter.Exclusions.none());
        assertThat(filter.hasEntityScope()).isFalse();
    }

    @Test
    void nullEntriesAreDroppedFromLists() {
        AnalyticsFilter filter = AnalyticsFilter.builder(AccountCategory.EXPENSE, ReportPeriod.year(2022))
                .build();
        AnalyticsFilter withNulls = new AnalyticsFilter(filter.accountCategory(), filter.reportPeriod(), null, null, null,
                Arrays.asList("1", null), null, null, null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null);

        assertThat(withNulls.entityCuis()).containsExactly("1");
        assertThat(withNulls.hasEntityScope()).isTrue();
    }

    @Test
    void accountCategoryAcceptsCodesAndLabels() {
        assertThat(AccountCategory.fromValue("ch")).isEqualTo(AccountCategory.EXPENSE);
        assertThat(AccountCategory.fromValue("income")).isEqualTo(AccountCategory.REVENUE);
        assertThat(AccountCategory.REVENUE.code()).isEqualTo("vn");
    }
}
