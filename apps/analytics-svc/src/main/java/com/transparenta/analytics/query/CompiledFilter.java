package com.transparenta.analytics.query;

import com.transparenta.analytics.model.PeriodType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link FilterCompiler}: WHERE and HAVING fragments with their bound values.
 * {@code havingPredicates} is empty when aggregate thresholds are applied after currency
 * conversion instead of in the store.
 */
public record CompiledFilter(
        List<String> wherePredicates,
        List<String> havingPredicates,
        Map<String, Object> parameters,
        JoinRequirements joins,
        PeriodType periodType,
        boolean aggregateThresholdsDeferred
) {

    public CompiledFilter {
        wherePredicates = List.copyOf(wherePredicates);
        havingPredicates = List.copyOf(havingPredicates);
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        joins = joins != null ? joins : JoinRequirements.NONE;
    }

    public String whereClause() {
        return wherePredicates.isEmpty() ? "" : "WHERE " + String.join("\n  AND ", wherePredicates);
    }

    public String havingClause() {
        return havingPredicates.isEmpty() ? "" : "HAVING " + String.join(" AND ", havingPredicates);
    }

    public String amountColumn() {
        return AmountColumns.itemColumn(periodType);
    }
}
