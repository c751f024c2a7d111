package com.lantern.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one metric inside a combined dashboard load: either the complete
 * value or the error that failed it. A failed metric never carries a partial
 * value.
 *
 * @param <T> the metric's result type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MetricOutcome<T> {

    @JsonProperty("value")
    private final T value;

    @JsonProperty("error")
    private final String error;

    @JsonIgnore
    private final Throwable cause;

    private MetricOutcome(T value, Throwable cause) {
        this.value = value;
        this.cause = cause;
        this.error = cause != null ? cause.getMessage() : null;
    }

    public static <T> MetricOutcome<T> success(T value) {
        return new MetricOutcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> MetricOutcome<T> failure(Throwable cause) {
        return new MetricOutcome<>(null, Objects.requireNonNull(cause, "cause"));
    }

    @JsonIgnore
    public boolean isSuccess() {
        return cause == null;
    }

    @JsonIgnore
    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    @JsonIgnore
    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "MetricOutcome{value=" + value + '}' : "MetricOutcome{error='" + error + "'}";
    }
}
