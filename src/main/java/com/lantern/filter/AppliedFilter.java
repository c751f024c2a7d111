package com.lantern.filter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Compiled form of a {@link FilterList}: a boolean SQL expression and the
 * parameters its placeholders reference.
 *
 * The expression is never empty. An empty filter list compiles to a tautology so
 * that it can always be appended after {@code WHERE ... AND}.
 */
public final class AppliedFilter {

    public static final String TAUTOLOGY = "1 = 1";

    private static final AppliedFilter EMPTY = new AppliedFilter(TAUTOLOGY, Collections.emptyMap());

    private final String query;
    private final Map<String, Object> params;

    public AppliedFilter(String query, Map<String, Object> params) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Filter expression must not be empty");
        }
        this.query = query;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(params, "params")));
    }

    public static AppliedFilter tautology() {
        return EMPTY;
    }

    public String getQuery() {
        return query;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public boolean isTautology() {
        return TAUTOLOGY.equals(query);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AppliedFilter that = (AppliedFilter) o;
        return query.equals(that.query) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, params);
    }

    @Override
    public String toString() {
        return "AppliedFilter{query='" + query + "', params=" + params.keySet() + "}";
    }
}
