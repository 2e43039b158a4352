package com.transparenta.analytics.repository;

import com.transparenta.analytics.query.CompiledFilter;

/**
 * One aggregation round-trip. Per-year queries additionally group by {@code year} and skip
 * HAVING, ordering and paging; those are finished in memory after conversion.
 */
public record AggregationQuery(CompiledFilter filter, boolean perYear, Integer limit, int offset) {

    public AggregationQuery {
        if (filter == null) {
            throw new IllegalArgumentException("filter must be provided");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
    }

    public static AggregationQuery paged(CompiledFilter filter, Integer limit, int offset) {
        return new AggregationQuery(filter, false, limit, offset);
    }

    public static AggregationQuery perYear(CompiledFilter filter) {
        return new AggregationQuery(filter, true, null, 0);
    }
}
