package com.lantern.filter;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Accumulates the named parameters of one ClickHouse statement and renders their
 * {@code {name: Type}} placeholders.
 *
 * Every value is bound exactly once under a unique name, so a query built through
 * this class never references an unbound placeholder and never carries an unused
 * parameter. Binding a name twice is a programming error.
 */
public final class QueryParameters {

    /**
     * Matches a ClickHouse query parameter placeholder; group 1 is the name, group 2 the type
     */
    public static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*):\\s*([^{}]+)\\}");

    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^A-Za-z0-9_]");

    private static final DateTimeFormatter DATETIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private static final String FILTER_PREFIX = "filter_";

    private final Map<String, Object> values = new LinkedHashMap<>();

    /**
     * Bind a value and return the placeholder that references it.
     *
     * Instants are formatted as ClickHouse {@code DateTime64(3)} text in UTC;
     * collections are copied.
     */
    public String bind(String name, String type, Object value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (values.containsKey(name)) {
            throw new IllegalStateException("Query parameter '" + name + "' is already bound");
        }
        values.put(name, normalize(value));
        return placeholder(name, type);
    }

    /**
     * Add all parameters of an already compiled filter
     */
    public QueryParameters include(AppliedFilter filter) {
        for (Map.Entry<String, Object> entry : filter.getParams().entrySet()) {
            if (values.containsKey(entry.getKey())) {
                throw new IllegalStateException("Query parameter '" + entry.getKey() + "' is already bound");
            }
            values.put(entry.getKey(), entry.getValue());
        }
        return this;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Snapshot of the bound parameters in binding order
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static String placeholder(String name, String type) {
        return "{" + name + ": " + type + "}";
    }

    /**
     * Parameter name for the filter at {@code index} of a filter list. The index
     * keeps two filters on the same column apart, the prefix keeps filter
     * parameters apart from the ones metric templates bind themselves.
     */
    public static String filterParameterName(String column, int index) {
        return FILTER_PREFIX + NON_IDENTIFIER.matcher(column).replaceAll("_") + "_" + index;
    }

    public static String formatDateTime(Instant instant) {
        return DATETIME_FORMATTER.format(instant);
    }

    private static Object normalize(Object value) {
        if (value instanceof Instant) {
            return formatDateTime((Instant) value);
        }
        if (value instanceof Collection) {
            return Collections.unmodifiableList(new ArrayList<>((Collection<?>) value));
        }
        return value;
    }
}
