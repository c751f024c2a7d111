package com.lantern.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable set of filter descriptors supplied by the dashboard.
 *
 * All conditions are conjoined, so order carries no meaning; it is kept so the
 * generated SQL text is deterministic.
 */
public final class FilterState implements Iterable<FilterCondition> {

    private static final FilterState EMPTY = new FilterState(Collections.emptyList());

    private final List<FilterCondition> conditions;

    @JsonCreator
    public FilterState(List<FilterCondition> conditions) {
        if (conditions == null) {
            this.conditions = Collections.emptyList();
        } else {
            List<FilterCondition> copy = new ArrayList<>(conditions.size());
            for (FilterCondition condition : conditions) {
                copy.add(Objects.requireNonNull(condition, "filter condition"));
            }
            this.conditions = Collections.unmodifiableList(copy);
        }
    }

    public static FilterState empty() {
        return EMPTY;
    }

    public static FilterState of(FilterCondition... conditions) {
        return new FilterState(Arrays.asList(conditions));
    }

    @JsonValue
    public List<FilterCondition> getConditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public int size() {
        return conditions.size();
    }

    @Override
    public Iterator<FilterCondition> iterator() {
        return conditions.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return conditions.equals(((FilterState) o).conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        return "FilterState" + conditions;
    }
}
