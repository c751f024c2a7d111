package com.lantern.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * Builds typed {@link FilterList}s from dashboard {@link FilterState}s against a
 * column catalog.
 *
 * The catalog is an explicit collaborator: it is handed in once and only read.
 * Every condition is resolved to its column, its operator is checked against the
 * column type, and its value is coerced to the Java type that column expects.
 */
public class FilterFactory {

    private static final Logger log = LoggerFactory.getLogger(FilterFactory.class);

    private static final DateTimeFormatter CLICKHOUSE_DATETIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]");

    private final ColumnCatalog catalog;

    public FilterFactory(ColumnCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * @throws UnknownFieldException if a condition names a column missing from the catalog
     * @throws UnsupportedOperatorException if an operator is unknown or not valid for the column type
     * @throws InvalidFilterValueException if a value cannot be coerced to the column type
     */
    public FilterList create(FilterState state) {
        if (state == null || state.isEmpty()) {
            return FilterList.empty();
        }

        List<Filter> filters = new ArrayList<>(state.size());
        for (FilterCondition condition : state) {
            filters.add(createFilter(condition));
        }

        log.debug("Created {} filters from filter state", filters.size());
        return new FilterList(filters);
    }

    private Filter createFilter(FilterCondition condition) {
        ColumnDefinition column = catalog.require(condition.getColumn());
        FilterOperator operator = FilterOperator.fromSymbol(condition.getOperator());

        if (!column.getType().supports(operator)) {
            throw new UnsupportedOperatorException(operator, column.getName(), column.getType());
        }

        String key = null;
        if (column.getType().isKeyed()) {
            key = condition.getKey();
            if (key == null || key.isBlank()) {
                throw new InvalidFilterValueException(column.getName(), "a key is required for "
                    + column.getType().getValue() + " columns");
            }
        }

        Object value = operator.requiresValue() ? coerce(column, condition.getValue()) : null;
        return new Filter(column, operator, value, key);
    }

    private Object coerce(ColumnDefinition column, Object raw) {
        if (raw == null) {
            throw new InvalidFilterValueException(column.getName(), "value is required");
        }
        return switch (column.getType()) {
            case STRING, STRING_OBJECT -> toText(column, raw);
            case NUMBER, NUMBER_OBJECT -> toDecimal(column, raw);
            case DATETIME -> toInstant(column, raw);
            case STRING_OPTIONS, ARRAY_OPTIONS -> toOptions(column, raw);
            case BOOLEAN -> toBoolean(column, raw);
        };
    }

    private static String toText(ColumnDefinition column, Object raw) {
        if (raw instanceof CharSequence || raw instanceof Number || raw instanceof Boolean) {
            return raw.toString();
        }
        throw new InvalidFilterValueException(column.getName(), "expected text but got " + describe(raw));
    }

    private static BigDecimal toDecimal(ColumnDefinition column, Object raw) {
        if (raw instanceof BigDecimal) {
            return (BigDecimal) raw;
        }
        if (raw instanceof Number || raw instanceof CharSequence) {
            try {
                return new BigDecimal(raw.toString().trim());
            } catch (NumberFormatException e) {
                throw new InvalidFilterValueException(column.getName(), "'" + raw + "' is not a number", e);
            }
        }
        throw new InvalidFilterValueException(column.getName(), "expected a number but got " + describe(raw));
    }

    private static Instant toInstant(ColumnDefinition column, Object raw) {
        if (raw instanceof Instant) {
            return (Instant) raw;
        }
        if (raw instanceof OffsetDateTime) {
            return ((OffsetDateTime) raw).toInstant();
        }
        if (raw instanceof ZonedDateTime) {
            return ((ZonedDateTime) raw).toInstant();
        }
        if (raw instanceof LocalDateTime) {
            return ((LocalDateTime) raw).toInstant(ZoneOffset.UTC);
        }
        if (raw instanceof Date) {
            return ((Date) raw).toInstant();
        }
        if (raw instanceof Long || raw instanceof Integer) {
            return Instant.ofEpochMilli(((Number) raw).longValue());
        }
        if (raw instanceof CharSequence) {
            return parseInstant(column, raw.toString().trim());
        }
        throw new InvalidFilterValueException(column.getName(), "expected a timestamp but got " + describe(raw));
    }

    private static Instant parseInstant(ColumnDefinition column, String text) {
        try {
            if (text.indexOf('T') > 0) {
                TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
                return parsed instanceof OffsetDateTime
                    ? ((OffsetDateTime) parsed).toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
            }
            return LocalDateTime.parse(text, CLICKHOUSE_DATETIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidFilterValueException(column.getName(), "'" + text + "' is not a timestamp", e);
        }
    }

    private static List<String> toOptions(ColumnDefinition column, Object raw) {
        Collection<?> items;
        if (raw instanceof Collection) {
            items = (Collection<?>) raw;
        } else if (raw instanceof Object[]) {
            items = Arrays.asList((Object[]) raw);
        } else if (raw instanceof CharSequence) {
            return Collections.singletonList(raw.toString());
        } else {
            throw new InvalidFilterValueException(column.getName(), "expected a list of options but got " + describe(raw));
        }

        List<String> options = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item == null) {
                throw new InvalidFilterValueException(column.getName(), "options must not contain null");
            }
            options.add(item.toString());
        }
        return Collections.unmodifiableList(options);
    }

    private static Boolean toBoolean(ColumnDefinition column, Object raw) {
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        if (raw instanceof CharSequence) {
            String text = raw.toString().trim();
            if ("true".equalsIgnoreCase(text)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text)) {
                return Boolean.FALSE;
            }
        }
        throw new InvalidFilterValueException(column.getName(), "expected true or false but got " + describe(raw));
    }

    private static String describe(Object raw) {
        return raw.getClass().getSimpleName() + " '" + raw + "'";
    }
}
