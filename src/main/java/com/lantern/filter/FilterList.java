package com.lantern.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Materialized, typed filters of one request, compiled into a single conjunctive
 * SQL expression by {@link #apply()}.
 */
public final class FilterList {

    private static final FilterList EMPTY = new FilterList(Collections.emptyList());

    private final List<Filter> filters;

    public FilterList(List<Filter> filters) {
        this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
    }

    public static FilterList empty() {
        return EMPTY;
    }

    /**
     * First filter matching the predicate, in list order
     */
    public Optional<Filter> find(Predicate<Filter> predicate) {
        for (Filter filter : filters) {
            if (predicate.test(filter)) {
                return Optional.of(filter);
            }
        }
        return Optional.empty();
    }

    public boolean anyMatch(Predicate<Filter> predicate) {
        return find(predicate).isPresent();
    }

    /**
     * Tables owning at least one filtered column
     */
    public Set<TableTag> referencedTables() {
        Set<TableTag> tables = EnumSet.noneOf(TableTag.class);
        for (Filter filter : filters) {
            tables.add(filter.getLogicalTable());
        }
        return tables;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public boolean isEmpty() {
        return filters.isEmpty();
    }

    public int size() {
        return filters.size();
    }

    /**
     * Compile the list into the AND of its predicates.
     *
     * Each filter binds its value under a name derived from its column and its
     * position, so two filters on the same column never share a placeholder.
     * An empty list yields {@link AppliedFilter#TAUTOLOGY}.
     */
    public AppliedFilter apply() {
        if (filters.isEmpty()) {
            return AppliedFilter.tautology();
        }

        QueryParameters parameters = new QueryParameters();
        List<String> predicates = new ArrayList<>(filters.size());
        for (int i = 0; i < filters.size(); i++) {
            Filter filter = filters.get(i);
            String name = QueryParameters.filterParameterName(filter.getField(), i);
            predicates.add(filter.toSql(name, parameters));
        }

        return new AppliedFilter(String.join(" AND ", predicates), parameters.asMap());
    }

    @Override
    public String toString() {
        return "FilterList" + filters;
    }
}
