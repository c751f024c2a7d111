package com.lantern.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Trace count of one time bucket, keyed by the bucket's start
 */
public final class TraceTimeBucket {

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("countTraceId")
    private final long countTraceId;

    @JsonCreator
    public TraceTimeBucket(
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("countTraceId") long countTraceId) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.countTraceId = countTraceId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getCountTraceId() {
        return countTraceId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TraceTimeBucket that = (TraceTimeBucket) o;
        return countTraceId == that.countTraceId && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, countTraceId);
    }

    @Override
    public String toString() {
        return "TraceTimeBucket{timestamp=" + timestamp + ", countTraceId=" + countTraceId + '}';
    }
}
