package com.transparenta.analytics.query;

import com.transparenta.analytics.model.AnalyticsFilter;
import com.transparenta.analytics.model.AnalyticsFilter.Exclusions;

/**
 * Decides which tables a filter needs besides {@code ExecutionLineItems}. Runs independently of
 * predicate compilation so that joins are only added when a field actually references them.
 */
public final class JoinAnalyzer {

    private JoinAnalyzer() {
    }

    public static JoinRequirements analyze(AnalyticsFilter filter) {
        Exclusions exclude = filter.exclude();
        boolean territorial = !filter.countyCodes().isEmpty()
                || filter.minPopulation() != null
                || filter.maxPopulation() != null
                || !exclude.countyCodes().isEmpty()
                || !exclude.regions().isEmpty();
        boolean entity = !filter.entityTypes().isEmpty()
                || filter.isUat() != null
                || !filter.uatIds().isEmpty()
                || filter.search() != null
                || !exclude.entityTypes().isEmpty()
                || !exclude.uatIds().isEmpty()
                || exclude.search() != null;
        if (!entity && !territorial) {
            return JoinRequirements.NONE;
        }
        return new JoinRequirements(entity, territorial);
    }
}
