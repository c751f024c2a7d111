package com.lantern.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Maps a dashboard-facing filter column to its physical ClickHouse column and
 * owning table.
 */
public final class ColumnDefinition {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("id")
    private final String id;

    @JsonProperty("table")
    private final TableTag table;

    @JsonProperty("column")
    private final String column;

    @JsonProperty("type")
    private final ColumnType type;

    @JsonCreator
    public ColumnDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("id") String id,
            @JsonProperty("table") TableTag table,
            @JsonProperty("column") String column,
            @JsonProperty("type") ColumnType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.id = id != null ? id : name;
        this.table = Objects.requireNonNull(table, "table");
        this.column = Objects.requireNonNull(column, "column");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public String getId() {
        return id;
    }

    public TableTag getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    public ColumnType getType() {
        return type;
    }

    /**
     * Column reference prefixed with the table alias, e.g. {@code o.provided_model_name}
     */
    @JsonIgnore
    public String getQualifiedColumn() {
        return table.qualify(column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ColumnDefinition that = (ColumnDefinition) o;
        return name.equals(that.name)
            && id.equals(that.id)
            && table == that.table
            && column.equals(that.column)
            && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, id, table, column, type);
    }

    @Override
    public String toString() {
        return "ColumnDefinition{name='" + name + "', table=" + table.getTableName()
            + ", column='" + column + "', type=" + type.getValue() + "}";
    }
}
