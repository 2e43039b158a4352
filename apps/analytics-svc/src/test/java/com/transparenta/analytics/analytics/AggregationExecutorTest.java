package com.transparenta.analytics.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.transparenta.analytics.model.AccountCategory;
import com.transparenta.analytics.model.AggregatedLineItems;
import com.transparenta.analytics.model.AggregatedRow;
import com.transparenta.analytics.model.AnalyticsFilter;
import com.transparenta.analytics.model.NormalizationMode;
import com.transparenta.analytics.model.ReportPeriod;
import com.transparenta.analytics.query.CompiledFilter;
import com.transparenta.analytics.query.FilterCompiler;
import com.transparenta.analytics.query.PeriodResolver;
import com.transparenta.analytics.repository.AggregationQuery;
import com.transparenta.analytics.repository.LineItemAggregationStore;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class AggregationExecutorTest {

    @Mock
    private LineItemAggregationStore store;

    private AggregationExecutor executor;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        executor = new AggregationExecutor(new FilterCompiler(new PeriodResolver()), store);
    }

    @Test
    void totalModePagesInTheStore() {
        AnalyticsFilter filter = AnalyticsFilter.builder(AccountCategory.EXPENSE, ReportPeriod.year(2023)).build();
        List<AggregatedRow> page = List.of(row("65.02.01", "10.01.01", "300", null));
        when(store.countGroups(any(CompiledFilter.class))).thenReturn(7);
        when(store.fetchGroups(any(AggregationQuery.class))).thenReturn(page);

        AggregatedLineItems result = executor.aggregate(filter, 1, 2);

        ArgumentCaptor<AggregationQuery> query = ArgumentCaptor.forClass(AggregationQuery.class);
        verify(store).fetchGroups(query.capture());
        assertThat(query.getValue().perYear()).isFalse();
        assertThat(query.getValue().limit()).isEqualTo(1);
        assertThat(query.getValue().offset()).isEqualTo(2);
        assertThat(result.rows()).isEqualTo(page);
        assertThat(result.totalCount()).isEqualTo(7);
    }

    @Test
    void emptyCountSkipsTheFetch() {
        AnalyticsFilter filter = AnalyticsFilter.builder(AccountCategory.EXPENSE, ReportPeriod.year(2023)).build();
        when(store.countGroups(any(CompiledFilter.class))).thenReturn(0);

        AggregatedLineItems result = executor.aggregate(filter, 10, 0);

        assertThat(result).isEqualTo(AggregatedLineItems.empty());
        verify(store, never()).fetchGroups(any());
    }

    @Test
    void currencyModeFetchesPerYearBucketsAndCountsPairs() {
        AnalyticsFilter filter = AnalyticsFilter.builder(AccountCategory.EXPENSE, ReportPeriod.years(2022, 2023))
                .normalization(NormalizationMode.TOTAL_CURRENCY)
                .build();
        when(store.fetchGroups(any(AggregationQuery.class))).thenReturn(List.of(
                row("65.02.01", "10.01.01", "100", 2022),
                row("65.02.01", "10.01.01", "120", 2023),
                row("66.01.01", "20.01.01", "50", 2023)));

        AggregatedLineItems result = executor.aggregate(filter, 10, 0);

        ArgumentCaptor<AggregationQuery> query = ArgumentCaptor.forClass(AggregationQuery.class);
        verify(store).fetchGroups(query.capture());
        assertThat(query.getValue().perYear()).isTrue();
        assertThat(result.rows()).hasSize(3);
        assertThat(result.totalCount()).isEqualTo(2);
        verify(store, never()).countGroups(any());
    }

    static AggregatedRow row(String functional, String economic, String amount, Integer year) {
        return new AggregatedRow(functional, "fn " + functional, economic, "ec " + economic, new BigDecimal(amount), 1, year);
    }
}
