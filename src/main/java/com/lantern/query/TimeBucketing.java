package com.lantern.query;

import java.util.Objects;

/**
 * SQL fragments for time-series metrics.
 *
 * The truncated column is grouped on, and the ordering fills every empty bucket
 * between the first and last one present with a zero row, so charts never show a
 * gap on the time axis.
 */
public final class TimeBucketing {

    private TimeBucketing() {
        throw new UnsupportedOperationException("TimeBucketing is a utility class and cannot be instantiated");
    }

    /**
     * {@code toStartOfDay(o.start_time) AS start_time}
     */
    public static String selectTruncated(DateTrunc granularity, String column, String alias) {
        Objects.requireNonNull(granularity, "granularity");
        return granularity.getTruncationFunction() + "(" + column + ") AS " + alias;
    }

    /**
     * {@code ORDER BY start_time ASC WITH FILL STEP toIntervalDay(1)}
     */
    public static String orderByWithFill(DateTrunc granularity, String alias) {
        Objects.requireNonNull(granularity, "granularity");
        return "ORDER BY " + alias + " ASC WITH FILL STEP " + granularity.getIntervalFunction() + "(1)";
    }
}
