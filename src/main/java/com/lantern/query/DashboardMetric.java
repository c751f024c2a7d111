package com.lantern.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The dashboard metrics backed by a query template
 */
public enum DashboardMetric {

    TOTAL_TRACES("total-traces"),
    MODEL_COST("model-cost"),
    SCORE_AGGREGATE("score-aggregate"),
    TRACES_BY_TIME("traces-by-time"),
    MODEL_USAGE_BY_TIME("model-usage-by-time"),
    DISTINCT_MODELS("distinct-models"),
    MODEL_USAGE_BY_USER("model-usage-by-user");

    private final String value;

    DashboardMetric(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
