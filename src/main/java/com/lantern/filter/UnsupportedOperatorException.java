package com.lantern.filter;

/**
 * Thrown when a filter uses an operator that does not exist, or that the
 * column's type does not support.
 */
public class UnsupportedOperatorException extends FilterValidationException {

    private static final long serialVersionUID = 1L;

    private final String operator;
    private final ColumnType columnType;

    /**
     * Operator symbol that names no known operator
     */
    public UnsupportedOperatorException(String operator) {
        super("Unknown filter operator: '" + operator + "'", null);
        this.operator = operator;
        this.columnType = null;
    }

    /**
     * Known operator that the column's type does not accept
     */
    public UnsupportedOperatorException(FilterOperator operator, String column, ColumnType columnType) {
        super(String.format("Operator '%s' is not supported for %s column '%s'",
            operator.getSymbol(), columnType.getValue(), column), column);
        this.operator = operator.getSymbol();
        this.columnType = columnType;
    }

    public String getOperator() {
        return operator;
    }

    public ColumnType getColumnType() {
        return columnType;
    }
}
