package com.transparenta.analytics.analytics;

import com.transparenta.analytics.model.AggregatedLineItems;
import com.transparenta.analytics.model.AggregatedRow;
import com.transparenta.analytics.model.AnalyticsFilter;
import com.transparenta.analytics.query.CompiledFilter;
import com.transparenta.analytics.query.FilterCompiler;
import com.transparenta.analytics.repository.AggregationQuery;
import com.transparenta.analytics.repository.LineItemAggregationStore;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the compiled aggregation against the store. Currency modes fetch per-year buckets so
 * that each year can be converted with its own rate; all other modes page in the store.
 */
@Component
public class AggregationExecutor {
    private static final Logger log = LoggerFactory.getLogger(AggregationExecutor.class);

    private final FilterCompiler filterCompiler;
    private final LineItemAggregationStore store;

    public AggregationExecutor(FilterCompiler filterCompiler, LineItemAggregationStore store) {
        this.filterCompiler = filterCompiler;
        this.store = store;
    }

    public AggregatedLineItems aggregate(AnalyticsFilter filter, Integer limit, int offset) {
        return aggregate(filter, filterCompiler.compile(filter), limit, offset);
    }

    public AggregatedLineItems aggregate(AnalyticsFilter filter, CompiledFilter compiled, Integer limit, int offset) {
        if (filter.normalization().requiresCurrencyConversion()) {
            List<AggregatedRow> buckets = store.fetchGroups(AggregationQuery.perYear(compiled));
            int pairs = (int) buckets.stream().map(AggregatedRow::classificationKey).distinct().count();
            log.debug("Fetched {} per-year buckets across {} classification pairs", buckets.size(), pairs);
            return new AggregatedLineItems(buckets, pairs);
        }
        int totalCount = store.countGroups(compiled);
        if (totalCount == 0) {
            return AggregatedLineItems.empty();
        }
        List<AggregatedRow> rows = store.fetchGroups(AggregationQuery.paged(compiled, limit, offset));
        return new AggregatedLineItems(rows, totalCount);
    }
}
