package com.transparenta.analytics.model;

import java.math.BigDecimal;

/**
 * A node of a classification drilldown. {@code code} is digits only; {@code percentage} is a
 * 0..1 share of the total of all groups returned for the same request.
 */
public record GroupedItem(
        String code,
        String name,
        BigDecimal value,
        long count,
        boolean isLeaf,
        double percentage,
        String humanSummary
) {
}
