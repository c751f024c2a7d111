package com.lantern.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Count and average value of the scores sharing a name, source and data type
 */
public final class ScoreAggregate {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("count")
    private final long count;

    @JsonProperty("avgValue")
    private final Double avgValue;

    @JsonProperty("source")
    private final String source;

    @JsonProperty("dataType")
    private final String dataType;

    @JsonCreator
    public ScoreAggregate(
            @JsonProperty("name") String name,
            @JsonProperty("count") long count,
            @JsonProperty("avgValue") Double avgValue,
            @JsonProperty("source") String source,
            @JsonProperty("dataType") String dataType) {
        this.name = name;
        this.count = count;
        this.avgValue = avgValue;
        this.source = source;
        this.dataType = dataType;
    }

    public String getName() {
        return name;
    }

    public long getCount() {
        return count;
    }

    public Double getAvgValue() {
        return avgValue;
    }

    public String getSource() {
        return source;
    }

    public String getDataType() {
        return dataType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ScoreAggregate that = (ScoreAggregate) o;
        return count == that.count
            && Objects.equals(name, that.name)
            && Objects.equals(avgValue, that.avgValue)
            && Objects.equals(source, that.source)
            && Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, count, avgValue, source, dataType);
    }

    @Override
    public String toString() {
        return "ScoreAggregate{name='" + name + "', count=" + count + ", avgValue=" + avgValue
            + ", source='" + source + "', dataType='" + dataType + "'}";
    }
}
