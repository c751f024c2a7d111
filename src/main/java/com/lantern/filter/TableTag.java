package com.lantern.filter;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Logical tables of the event store. Every catalog column belongs to exactly one
 * of them, and metric queries are based on one of them.
 */
public enum TableTag {

    TRACES("traces", "t", false),

    /**
     * Observations reference their parent trace through {@code trace_id}.
     */
    OBSERVATIONS("observations", "o", true),

    /**
     * Scores reference their parent trace through {@code trace_id}.
     */
    SCORES("scores", "s", true);

    private final String tableName;
    private final String alias;
    private final boolean traceChild;

    TableTag(String tableName, String alias, boolean traceChild) {
        this.tableName = tableName;
        this.alias = alias;
        this.traceChild = traceChild;
    }

    @JsonValue
    public String getTableName() {
        return tableName;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * Whether rows of this table carry a {@code trace_id} that can be joined to traces.
     */
    public boolean isTraceChild() {
        return traceChild;
    }

    /**
     * Prefix a physical column with this table's alias, e.g. {@code t.user_id}.
     */
    public String qualify(String column) {
        return alias + "." + column;
    }

    /**
     * Parse a physical table name to TableTag
     */
    public static TableTag fromValue(String value) {
        for (TableTag table : TableTag.values()) {
            if (table.tableName.equalsIgnoreCase(value)) {
                return table;
            }
        }
        throw new IllegalArgumentException("Unknown table: " + value);
    }
}
