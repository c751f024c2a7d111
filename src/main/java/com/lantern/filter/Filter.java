package com.lantern.filter;

import java.util.Objects;

/**
 * A single typed predicate over one catalog column.
 *
 * Instances are created by {@link FilterFactory}, which has already checked the
 * operator against the column type and coerced the value, so rendering never
 * has to validate again.
 */
public final class Filter {

    private final ColumnDefinition column;
    private final FilterOperator operator;
    private final Object value;
    private final String key;

    Filter(ColumnDefinition column, FilterOperator operator, Object value, String key) {
        this.column = Objects.requireNonNull(column, "column");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = value;
        this.key = key;
    }

    /**
     * Physical column name, without table alias
     */
    public String getField() {
        return column.getColumn();
    }

    public FilterOperator getOperator() {
        return operator;
    }

    /**
     * Typed value: String, BigDecimal, Instant, List of String, Boolean, or null
     * for null checks
     */
    public Object getValue() {
        return value;
    }

    /**
     * Map key addressed by object column filters, null otherwise
     */
    public String getKey() {
        return key;
    }

    public TableTag getLogicalTable() {
        return column.getTable();
    }

    public ColumnType getColumnType() {
        return column.getType();
    }

    public ColumnDefinition getColumn() {
        return column;
    }

    /**
     * Whether this filter bounds {@code table.field} from below ({@code >} or {@code >=})
     */
    public boolean isLowerBoundOn(TableTag table, String field) {
        return column.getTable() == table && column.getColumn().equals(field) && operator.isLowerBound();
    }

    /**
     * Render this predicate, binding its value(s) under {@code parameterName}.
     */
    String toSql(String parameterName, QueryParameters parameters) {
        String target = column.getQualifiedColumn();

        if (operator == FilterOperator.IS_NULL) {
            return target + " IS NULL";
        }
        if (operator == FilterOperator.IS_NOT_NULL) {
            return target + " IS NOT NULL";
        }

        ColumnType type = column.getType();
        if (type.isKeyed()) {
            target = target + "[" + parameters.bind(parameterName + "_key", "String", key) + "]";
        }
        String placeholder = parameters.bind(parameterName, type.getParameterType(), value);

        return switch (type) {
            case STRING, STRING_OBJECT -> stringPredicate(target, placeholder);
            case NUMBER, DATETIME, NUMBER_OBJECT, BOOLEAN ->
                target + " " + operator.getSqlComparator() + " " + placeholder;
            case STRING_OPTIONS -> switch (operator) {
                case ANY_OF -> target + " IN " + placeholder;
                case NONE_OF -> target + " NOT IN " + placeholder;
                default -> throw unsupported();
            };
            case ARRAY_OPTIONS -> switch (operator) {
                case ANY_OF -> "hasAny(" + target + ", " + placeholder + ")";
                case ALL_OF -> "hasAll(" + target + ", " + placeholder + ")";
                case NONE_OF -> "NOT hasAny(" + target + ", " + placeholder + ")";
                default -> throw unsupported();
            };
        };
    }

    private String stringPredicate(String target, String placeholder) {
        return switch (operator) {
            case EQUALS, NOT_EQUALS -> target + " " + operator.getSqlComparator() + " " + placeholder;
            case CONTAINS -> "position(" + target + ", " + placeholder + ") > 0";
            case DOES_NOT_CONTAIN -> "position(" + target + ", " + placeholder + ") = 0";
            case STARTS_WITH -> "startsWith(" + target + ", " + placeholder + ")";
            case ENDS_WITH -> "endsWith(" + target + ", " + placeholder + ")";
            default -> throw unsupported();
        };
    }

    private UnsupportedOperatorException unsupported() {
        return new UnsupportedOperatorException(operator, column.getName(), column.getType());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Filter filter = (Filter) o;
        return column.equals(filter.column)
            && operator == filter.operator
            && Objects.equals(value, filter.value)
            && Objects.equals(key, filter.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, operator, value, key);
    }

    @Override
    public String toString() {
        return column.getQualifiedColumn() + (key != null ? "[" + key + "]" : "")
            + " " + operator.getSymbol() + (operator.requiresValue() ? " " + value : "");
    }
}
