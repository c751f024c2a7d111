package com.lantern.filter;

/**
 * Thrown when a filter targets a table that a metric can neither read directly
 * nor reach through its join, for example a score filter on an observation metric.
 */
public class UnsupportedTableException extends FilterValidationException {

    private static final long serialVersionUID = 1L;

    private final TableTag filterTable;
    private final TableTag baseTable;

    public UnsupportedTableException(String column, TableTag filterTable, TableTag baseTable) {
        super(String.format("Filter column '%s' on table '%s' cannot be applied to a query on '%s'",
            column, filterTable.getTableName(), baseTable.getTableName()), column);
        this.filterTable = filterTable;
        this.baseTable = baseTable;
    }

    public TableTag getFilterTable() {
        return filterTable;
    }

    public TableTag getBaseTable() {
        return baseTable;
    }
}
