package com.lantern.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Granularities a dashboard time series can be bucketed by, with the ClickHouse
 * functions that truncate a timestamp to the bucket start and step one bucket.
 */
public enum DateTrunc {

    YEAR("year", "toStartOfYear", "toIntervalYear"),
    MONTH("month", "toStartOfMonth", "toIntervalMonth"),
    WEEK("week", "toStartOfWeek", "toIntervalWeek"),
    DAY("day", "toStartOfDay", "toIntervalDay"),
    HOUR("hour", "toStartOfHour", "toIntervalHour"),
    MINUTE("minute", "toStartOfMinute", "toIntervalMinute");

    private final String value;
    private final String truncationFunction;
    private final String intervalFunction;

    DateTrunc(String value, String truncationFunction, String intervalFunction) {
        this.value = value;
        this.truncationFunction = truncationFunction;
        this.intervalFunction = intervalFunction;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getTruncationFunction() {
        return truncationFunction;
    }

    public String getIntervalFunction() {
        return intervalFunction;
    }

    /**
     * Parse the dashboard's granularity name. Validating granularities is the
     * caller's job, so an unknown name is a programming error.
     *
     * @throws IllegalArgumentException if the name is not a supported granularity
     */
    @JsonCreator
    public static DateTrunc fromValue(String value) {
        for (DateTrunc granularity : DateTrunc.values()) {
            if (granularity.value.equalsIgnoreCase(value)) {
                return granularity;
            }
        }
        throw new IllegalArgumentException("Unknown granularity: " + value);
    }
}
