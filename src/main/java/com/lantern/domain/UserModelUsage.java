package com.lantern.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Usage and cost attributed to one end user through their traces
 */
public final class UserModelUsage {

    @JsonProperty("sumUsageDetails")
    private final BigDecimal sumUsageDetails;

    @JsonProperty("sumCostDetails")
    private final BigDecimal sumCostDetails;

    @JsonProperty("userId")
    private final String userId;

    @JsonCreator
    public UserModelUsage(
            @JsonProperty("sumUsageDetails") BigDecimal sumUsageDetails,
            @JsonProperty("sumCostDetails") BigDecimal sumCostDetails,
            @JsonProperty("userId") String userId) {
        this.sumUsageDetails = sumUsageDetails;
        this.sumCostDetails = sumCostDetails;
        this.userId = Objects.requireNonNull(userId, "userId");
    }

    public BigDecimal getSumUsageDetails() {
        return sumUsageDetails;
    }

    public BigDecimal getSumCostDetails() {
        return sumCostDetails;
    }

    public String getUserId() {
        return userId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UserModelUsage that = (UserModelUsage) o;
        return userId.equals(that.userId)
            && Objects.equals(sumUsageDetails, that.sumUsageDetails)
            && Objects.equals(sumCostDetails, that.sumCostDetails);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sumUsageDetails, sumCostDetails, userId);
    }

    @Override
    public String toString() {
        return "UserModelUsage{sumUsageDetails=" + sumUsageDetails + ", sumCostDetails=" + sumCostDetails
            + ", userId='" + userId + "'}";
    }
}
