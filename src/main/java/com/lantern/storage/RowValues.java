package com.lantern.storage;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Locale;
import java.util.Map;

/**
 * Reads typed values out of store result rows.
 *
 * ClickHouse returns wide integers and decimals as text or as BigInteger/BigDecimal
 * to keep their precision, and timestamps as text or as local date-times in UTC,
 * depending on the driver and output format. These helpers accept all of them.
 * A value that cannot be read fails the whole metric with a
 * {@link StoreExecutionException}.
 */
public final class RowValues {

    private static final DateTimeFormatter CLICKHOUSE_DATETIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSSSSSSSS][.SSSSSS][.SSS]");

    private RowValues() {
        throw new UnsupportedOperationException("RowValues is a utility class and cannot be instantiated");
    }

    public static String getString(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value != null ? value.toString() : null;
    }

    /**
     * @throws StoreExecutionException if the column is missing or not an integer
     */
    public static long getLong(Map<String, Object> row, String column) {
        Object value = require(row, column);
        try {
            if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            if (value instanceof BigInteger) {
                return ((BigInteger) value).longValueExact();
            }
            if (value instanceof BigDecimal) {
                return ((BigDecimal) value).longValueExact();
            }
            if (value instanceof Number) {
                return new BigDecimal(value.toString()).longValueExact();
            }
            return new BigDecimal(value.toString().trim()).longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw unreadable(column, value, "an integer", e);
        }
    }

    /**
     * @return the decimal value, or null if the column is null
     * @throws StoreExecutionException if the value is not numeric
     */
    public static BigDecimal getDecimal(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw unreadable(column, value, "a decimal", e);
        }
    }

    /**
     * Reads a floating point aggregate; ClickHouse renders non-finite results as
     * {@code nan}, {@code inf} and {@code -inf}.
     *
     * @return the value, or null if the column is null
     */
    public static Double getDouble(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        switch (text) {
            case "nan":
                return Double.NaN;
            case "inf":
            case "+inf":
                return Double.POSITIVE_INFINITY;
            case "-inf":
                return Double.NEGATIVE_INFINITY;
            default:
                try {
                    return Double.parseDouble(text);
                } catch (NumberFormatException e) {
                    throw unreadable(column, value, "a number", e);
                }
        }
    }

    /**
     * Zone-less date-times and text are interpreted as UTC; {@link Timestamp} and
     * {@link Date} already denote an instant and are taken as is.
     *
     * @throws StoreExecutionException if the column is missing or not a timestamp
     */
    public static Instant getInstant(Map<String, Object> row, String column) {
        Object value = require(row, column);
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        return parseInstant(column, value.toString().trim());
    }

    private static Instant parseInstant(String column, String text) {
        try {
            if (text.indexOf('T') > 0) {
                TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
                return parsed instanceof OffsetDateTime
                    ? ((OffsetDateTime) parsed).toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
            }
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            return LocalDateTime.parse(text, CLICKHOUSE_DATETIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw unreadable(column, text, "a timestamp", e);
        }
    }

    private static Object require(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            throw new StoreExecutionException("Result column '" + column + "' is missing or null");
        }
        return value;
    }

    private static StoreExecutionException unreadable(String column, Object value, String expected, Throwable cause) {
        return new StoreExecutionException(
            "Result column '" + column + "' value '" + value + "' is not " + expected, cause);
    }
}
