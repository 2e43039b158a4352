package com.transparenta.analytics.model;

import java.util.List;

/**
 * A page of aggregated rows plus the number of distinct classification groups across all pages.
 */
public record AggregatedLineItems(List<AggregatedRow> rows, int totalCount) {

    public AggregatedLineItems {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static AggregatedLineItems empty() {
        return new AggregatedLineItems(List.of(), 0);
    }

    public PageInfo pageInfo(Integer limit, int offset) {
        boolean hasNext = limit != null && offset + limit < totalCount;
        return new PageInfo(totalCount, hasNext, offset > 0);
    }

    public record PageInfo(int totalCount, boolean hasNextPage, boolean hasPreviousPage) {
    }
}
