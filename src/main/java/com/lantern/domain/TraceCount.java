package com.lantern.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Number of traces matching a dashboard filter
 */
public final class TraceCount {

    @JsonProperty("countTraceId")
    private final long countTraceId;

    @JsonCreator
    public TraceCount(@JsonProperty("countTraceId") long countTraceId) {
        this.countTraceId = countTraceId;
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
        return countTraceId == ((TraceCount) o).countTraceId;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(countTraceId);
    }

    @Override
    public String toString() {
        return "TraceCount{countTraceId=" + countTraceId + '}';
    }
}
