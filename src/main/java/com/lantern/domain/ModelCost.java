package com.lantern.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Total cost and usage of one model. The sums are null when no observation of
 * the model reported a total.
 */
public final class ModelCost {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("sumCostDetails")
    private final BigDecimal sumCostDetails;

    @JsonProperty("sumUsageDetails")
    private final BigDecimal sumUsageDetails;

    @JsonCreator
    public ModelCost(
            @JsonProperty("name") String name,
            @JsonProperty("sumCostDetails") BigDecimal sumCostDetails,
            @JsonProperty("sumUsageDetails") BigDecimal sumUsageDetails) {
        this.name = name;
        this.sumCostDetails = sumCostDetails;
        this.sumUsageDetails = sumUsageDetails;
    }

    public String getName() {
        return name;
    }

    public BigDecimal getSumCostDetails() {
        return sumCostDetails;
    }

    public BigDecimal getSumUsageDetails() {
        return sumUsageDetails;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ModelCost that = (ModelCost) o;
        return Objects.equals(name, that.name)
            && Objects.equals(sumCostDetails, that.sumCostDetails)
            && Objects.equals(sumUsageDetails, that.sumUsageDetails);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sumCostDetails, sumUsageDetails);
    }

    @Override
    public String toString() {
        return "ModelCost{name='" + name + "', sumCostDetails=" + sumCostDetails
            + ", sumUsageDetails=" + sumUsageDetails + '}';
    }
}
