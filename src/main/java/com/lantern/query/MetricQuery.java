package com.lantern.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A composed ClickHouse statement with its named parameters, ready to execute.
 */
public final class MetricQuery {

    private final DashboardMetric metric;
    private final String sql;
    private final Map<String, Object> params;

    public MetricQuery(DashboardMetric metric, String sql, Map<String, Object> params) {
        this.metric = Objects.requireNonNull(metric, "metric");
        this.sql = Objects.requireNonNull(sql, "sql");
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public DashboardMetric getMetric() {
        return metric;
    }

    public String getSql() {
        return sql;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    @Override
    public String toString() {
        return "MetricQuery{metric=" + metric.getValue() + ", params=" + params.keySet() + ", sql='" + sql + "'}";
    }
}
