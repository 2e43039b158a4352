package com.transparenta.analytics.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered accumulator of SQL predicates and their bound values. Each bound value receives a
 * positional named parameter ({@code :p1}, {@code :p2}, ...); callers only ever splice the
 * returned placeholder into SQL, never the value itself.
 */
public final class SqlConditions {

    private final List<String> predicates = new ArrayList<>();
    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private int nextIndex = 1;

    public String bind(Object value) {
        String name = "p" + nextIndex++;
        parameters.put(name, value);
        return ":" + name;
    }

    public SqlConditions add(String predicate) {
        predicates.add(predicate);
        return this;
    }

    public List<String> predicates() {
        return Collections.unmodifiableList(predicates);
    }

    public Map<String, Object> parameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public boolean isEmpty() {
        return predicates.isEmpty();
    }

    public String whereClause() {
        return predicates.isEmpty() ? "" : "WHERE " + String.join("\n  AND ", predicates);
    }
}
