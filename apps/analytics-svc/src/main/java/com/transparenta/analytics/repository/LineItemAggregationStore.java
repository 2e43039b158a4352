package com.transparenta.analytics.repository;

import com.transparenta.analytics.model.AggregatedRow;
import com.transparenta.analytics.query.CompiledFilter;
import java.util.List;

public interface LineItemAggregationStore {

    /**
     * Sums line-item amounts per (functional, economic) classification pair, or per
     * (functional, economic, year) when {@link AggregationQuery#perYear()} is set.
     */
    List<AggregatedRow> fetchGroups(AggregationQuery query);

    /**
     * Number of classification pairs that survive the filter's WHERE and HAVING clauses.
     */
    int countGroups(CompiledFilter filter);
}
