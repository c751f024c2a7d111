package com.lantern.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One filter descriptor as the dashboard sends it: a catalog column reference,
 * an operator symbol and an untyped value. Object columns additionally name a key.
 */
public final class FilterCondition {

    @JsonProperty("column")
    private final String column;

    @JsonProperty("operator")
    private final String operator;

    @JsonProperty("value")
    private final Object value;

    @JsonProperty("key")
    private final String key;

    @JsonCreator
    public FilterCondition(
            @JsonProperty("column") String column,
            @JsonProperty("operator") String operator,
            @JsonProperty("value") Object value,
            @JsonProperty("key") String key) {
        this.column = column;
        this.operator = operator;
        this.value = value;
        this.key = key;
    }

    public static FilterCondition of(String column, String operator, Object value) {
        return new FilterCondition(column, operator, value, null);
    }

    public static FilterCondition keyed(String column, String key, String operator, Object value) {
        return new FilterCondition(column, operator, value, key);
    }

    public static FilterCondition isNull(String column) {
        return new FilterCondition(column, FilterOperator.IS_NULL.getSymbol(), null, null);
    }

    public String getColumn() {
        return column;
    }

    public String getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    public String getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FilterCondition that = (FilterCondition) o;
        return Objects.equals(column, that.column)
            && Objects.equals(operator, that.operator)
            && Objects.equals(value, that.value)
            && Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, operator, value, key);
    }

    @Override
    public String toString() {
        return "FilterCondition{column='" + column + "', operator='" + operator + "', value=" + value
            + (key != null ? ", key='" + key + "'" : "") + "}";
    }
}
