package com.lantern.filter;

import java.util.List;
import java.util.Locale;

/**
 * Operators a dashboard filter may use. Each operator is parsed once from the
 * symbol the dashboard sends; rendering dispatches on the enum, never on text.
 */
public enum FilterOperator {

    EQUALS("=", "=", List.of()),
    NOT_EQUALS("!=", "!=", List.of("<>")),
    GREATER_THAN(">", ">", List.of()),
    GREATER_THAN_OR_EQUAL(">=", ">=", List.of()),
    LESS_THAN("<", "<", List.of()),
    LESS_THAN_OR_EQUAL("<=", "<=", List.of()),
    ANY_OF("any of", null, List.of("in")),
    NONE_OF("none of", null, List.of("not in", "not-in")),
    ALL_OF("all of", null, List.of()),
    CONTAINS("contains", null, List.of()),
    DOES_NOT_CONTAIN("does not contain", null, List.of()),
    STARTS_WITH("starts with", null, List.of()),
    ENDS_WITH("ends with", null, List.of()),
    IS_NULL("is null", null, List.of()),
    IS_NOT_NULL("is not null", null, List.of());

    private final String symbol;
    private final String sqlComparator;
    private final List<String> aliases;

    FilterOperator(String symbol, String sqlComparator, List<String> aliases) {
        this.symbol = symbol;
        this.sqlComparator = sqlComparator;
        this.aliases = aliases;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * The binary SQL comparator for comparison operators.
     *
     * @throws IllegalStateException if this operator is not a plain comparison
     */
    public String getSqlComparator() {
        if (sqlComparator == null) {
            throw new IllegalStateException("Operator '" + symbol + "' has no SQL comparator");
        }
        return sqlComparator;
    }

    public boolean isComparison() {
        return sqlComparator != null;
    }

    /**
     * {@code >} and {@code >=}: the operators that open a time window from below.
     */
    public boolean isLowerBound() {
        return this == GREATER_THAN || this == GREATER_THAN_OR_EQUAL;
    }

    public boolean requiresValue() {
        return this != IS_NULL && this != IS_NOT_NULL;
    }

    /**
     * Parse a dashboard operator symbol, case-insensitively.
     *
     * @throws UnsupportedOperatorException if the symbol names no known operator
     */
    public static FilterOperator fromSymbol(String symbol) {
        if (symbol != null) {
            String normalized = symbol.trim().toLowerCase(Locale.ROOT);
            for (FilterOperator operator : values()) {
                if (operator.symbol.equals(normalized) || operator.aliases.contains(normalized)) {
                    return operator;
                }
            }
        }
        throw new UnsupportedOperatorException(symbol);
    }
}
