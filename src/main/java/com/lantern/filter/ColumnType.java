package com.lantern.filter;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.lantern.filter.FilterOperator.ALL_OF;
import static com.lantern.filter.FilterOperator.ANY_OF;
import static com.lantern.filter.FilterOperator.CONTAINS;
import static com.lantern.filter.FilterOperator.DOES_NOT_CONTAIN;
import static com.lantern.filter.FilterOperator.ENDS_WITH;
import static com.lantern.filter.FilterOperator.EQUALS;
import static com.lantern.filter.FilterOperator.GREATER_THAN;
import static com.lantern.filter.FilterOperator.GREATER_THAN_OR_EQUAL;
import static com.lantern.filter.FilterOperator.IS_NOT_NULL;
import static com.lantern.filter.FilterOperator.IS_NULL;
import static com.lantern.filter.FilterOperator.LESS_THAN;
import static com.lantern.filter.FilterOperator.LESS_THAN_OR_EQUAL;
import static com.lantern.filter.FilterOperator.NONE_OF;
import static com.lantern.filter.FilterOperator.NOT_EQUALS;
import static com.lantern.filter.FilterOperator.STARTS_WITH;

/**
 * Value type of a catalog column. Determines which operators a filter on the
 * column may use and the ClickHouse type its parameter is bound as.
 */
public enum ColumnType {

    STRING("string", "String",
        EnumSet.of(EQUALS, NOT_EQUALS, CONTAINS, DOES_NOT_CONTAIN, STARTS_WITH, ENDS_WITH, IS_NULL, IS_NOT_NULL)),

    NUMBER("number", "Decimal64(12)",
        EnumSet.of(EQUALS, NOT_EQUALS, GREATER_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL,
            IS_NULL, IS_NOT_NULL)),

    DATETIME("datetime", "DateTime64(3)",
        EnumSet.of(EQUALS, NOT_EQUALS, GREATER_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL,
            IS_NULL, IS_NOT_NULL)),

    STRING_OPTIONS("stringOptions", "Array(String)",
        EnumSet.of(ANY_OF, NONE_OF, IS_NULL, IS_NOT_NULL)),

    ARRAY_OPTIONS("arrayOptions", "Array(String)",
        EnumSet.of(ANY_OF, ALL_OF, NONE_OF)),

    BOOLEAN("boolean", "Boolean",
        EnumSet.of(EQUALS, NOT_EQUALS, IS_NULL, IS_NOT_NULL)),

    /**
     * {@code Map(String, String)} columns such as metadata; filters address one key.
     */
    STRING_OBJECT("stringObject", "String",
        EnumSet.of(EQUALS, NOT_EQUALS, CONTAINS, DOES_NOT_CONTAIN, STARTS_WITH, ENDS_WITH)),

    /**
     * {@code Map(String, Decimal)} columns such as usage details; filters address one key.
     */
    NUMBER_OBJECT("numberObject", "Decimal64(12)",
        EnumSet.of(EQUALS, NOT_EQUALS, GREATER_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL));

    private final String value;
    private final String parameterType;
    private final Set<FilterOperator> supportedOperators;

    ColumnType(String value, String parameterType, EnumSet<FilterOperator> supportedOperators) {
        this.value = value;
        this.parameterType = parameterType;
        this.supportedOperators = Collections.unmodifiableSet(supportedOperators);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * ClickHouse type used in {@code {name: Type}} placeholders for values of this column.
     */
    public String getParameterType() {
        return parameterType;
    }

    public Set<FilterOperator> getSupportedOperators() {
        return supportedOperators;
    }

    public boolean supports(FilterOperator operator) {
        return supportedOperators.contains(operator);
    }

    public boolean isKeyed() {
        return this == STRING_OBJECT || this == NUMBER_OBJECT;
    }

    public static ColumnType fromValue(String value) {
        for (ColumnType type : ColumnType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown column type: " + value);
    }
}
