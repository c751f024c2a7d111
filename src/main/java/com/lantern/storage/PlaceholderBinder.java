package com.lantern.storage;

import com.lantern.filter.QueryParameters;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Rewrites ClickHouse {@code {name: Type}} placeholders into positional JDBC
 * parameters, collecting the bound values in placeholder order.
 *
 * Each parameter keeps its declared type as {@code CAST(? AS Type)}: the driver
 * inlines arguments as literals, and a bare text literal cannot take part in
 * DateTime64 or Decimal arithmetic.
 */
public final class PlaceholderBinder {

    private PlaceholderBinder() {
        throw new UnsupportedOperationException("PlaceholderBinder is a utility class and cannot be instantiated");
    }

    /**
     * @throws StoreExecutionException if a placeholder has no value in {@code params}
     */
    public static BoundStatement bind(String query, Map<String, Object> params) {
        Matcher matcher = QueryParameters.PLACEHOLDER.matcher(query);
        StringBuilder sql = new StringBuilder(query.length());
        List<Object> arguments = new ArrayList<>();

        while (matcher.find()) {
            String name = matcher.group(1);
            if (!params.containsKey(name)) {
                throw new StoreExecutionException("No value bound for query parameter '" + name + "'");
            }
            arguments.add(toJdbcValue(params.get(name)));
            String type = matcher.group(2).trim();
            matcher.appendReplacement(sql, Matcher.quoteReplacement("CAST(? AS " + type + ")"));
        }
        matcher.appendTail(sql);

        return new BoundStatement(sql.toString(), arguments.toArray());
    }

    /**
     * The ClickHouse driver binds arrays, not collections, as {@code Array(T)}
     */
    private static Object toJdbcValue(Object value) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).toArray();
        }
        return value;
    }

    /**
     * A statement with positional parameters and their arguments
     */
    public static final class BoundStatement {

        private final String sql;
        private final Object[] arguments;

        BoundStatement(String sql, Object[] arguments) {
            this.sql = sql;
            this.arguments = arguments;
        }

        public String getSql() {
            return sql;
        }

        public Object[] getArguments() {
            return arguments.clone();
        }
    }
}
