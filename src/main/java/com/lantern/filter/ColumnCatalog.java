package com.lantern.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog of the columns dashboard filters may reference.
 *
 * Columns are looked up by their display name or by their id. The catalog is
 * loaded once at startup and shared by every request.
 */
public final class ColumnCatalog {

    private final List<ColumnDefinition> columns;
    private final Map<String, ColumnDefinition> byReference;

    public ColumnCatalog(List<ColumnDefinition> columns) {
        Map<String, ColumnDefinition> index = new LinkedHashMap<>();
        for (ColumnDefinition column : columns) {
            register(index, column.getName(), column);
            if (!column.getId().equals(column.getName())) {
                register(index, column.getId(), column);
            }
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.byReference = Collections.unmodifiableMap(index);
    }

    private static void register(Map<String, ColumnDefinition> index, String reference, ColumnDefinition column) {
        ColumnDefinition previous = index.putIfAbsent(reference, column);
        if (previous != null && !previous.equals(column)) {
            throw new IllegalArgumentException("Duplicate catalog column reference: '" + reference + "'");
        }
    }

    public Optional<ColumnDefinition> find(String reference) {
        if (reference == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byReference.get(reference));
    }

    /**
     * @throws UnknownFieldException if no column has this name or id
     */
    public ColumnDefinition require(String reference) {
        return find(reference).orElseThrow(() -> new UnknownFieldException(reference));
    }

    public List<ColumnDefinition> getColumns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }
}
