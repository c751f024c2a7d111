package com.lantern.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Usage and cost of one model within one time bucket. Gap-filled buckets carry
 * zero sums and an empty model name.
 */
public final class ModelUsageTimeBucket {

    @JsonProperty("startTime")
    private final Instant startTime;

    @JsonProperty("sumUsageDetails")
    private final BigDecimal sumUsageDetails;

    @JsonProperty("sumCostDetails")
    private final BigDecimal sumCostDetails;

    @JsonProperty("providedModelName")
    private final String providedModelName;

    @JsonCreator
    public ModelUsageTimeBucket(
            @JsonProperty("startTime") Instant startTime,
            @JsonProperty("sumUsageDetails") BigDecimal sumUsageDetails,
            @JsonProperty("sumCostDetails") BigDecimal sumCostDetails,
            @JsonProperty("providedModelName") String providedModelName) {
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.sumUsageDetails = sumUsageDetails;
        this.sumCostDetails = sumCostDetails;
        this.providedModelName = providedModelName;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public BigDecimal getSumUsageDetails() {
        return sumUsageDetails;
    }

    public BigDecimal getSumCostDetails() {
        return sumCostDetails;
    }

    public String getProvidedModelName() {
        return providedModelName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ModelUsageTimeBucket that = (ModelUsageTimeBucket) o;
        return startTime.equals(that.startTime)
            && Objects.equals(sumUsageDetails, that.sumUsageDetails)
            && Objects.equals(sumCostDetails, that.sumCostDetails)
            && Objects.equals(providedModelName, that.providedModelName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startTime, sumUsageDetails, sumCostDetails, providedModelName);
    }

    @Override
    public String toString() {
        return "ModelUsageTimeBucket{startTime=" + startTime + ", sumUsageDetails=" + sumUsageDetails
            + ", sumCostDetails=" + sumCostDetails + ", providedModelName='" + providedModelName + "'}";
    }
}
