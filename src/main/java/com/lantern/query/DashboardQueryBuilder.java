package com.lantern.query;

import com.lantern.filter.AppliedFilter;
import com.lantern.filter.Filter;
import com.lantern.filter.FilterFactory;
import com.lantern.filter.FilterList;
import com.lantern.filter.FilterState;
import com.lantern.filter.QueryParameters;
import com.lantern.filter.TableTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Composes the ClickHouse statement of every dashboard metric.
 *
 * Each template scopes its base table to the project, appends the compiled
 * filter expression, and adds the join, time bucketing and trace timestamp
 * widening fragments the metric needs. Composition is pure: it neither holds
 * state between calls nor touches the store.
 */
@Component
public class DashboardQueryBuilder {

    private static final Logger log = LoggerFactory.getLogger(DashboardQueryBuilder.class);

    static final String PROJECT_ID = "projectId";

    private final FilterFactory filterFactory;
    private final JoinPlanner joinPlanner;
    private final TraceTimestampWidening traceTimestampWidening;

    public DashboardQueryBuilder(
            FilterFactory filterFactory,
            JoinPlanner joinPlanner,
            TraceTimestampWidening traceTimestampWidening) {
        this.filterFactory = filterFactory;
        this.joinPlanner = joinPlanner;
        this.traceTimestampWidening = traceTimestampWidening;
    }

    /**
     * Number of traces in the project matching the filters
     */
    public MetricQuery totalTraces(String projectId, FilterState state) {
        FilterList filters = filterFactory.create(state);
        JoinPlan join = joinPlanner.plan(TableTag.TRACES, filters, JoinPolicy.none());
        QueryParameters parameters = new QueryParameters();

        String sql = compose(
            "SELECT count(t.id) AS count",
            "FROM traces t FINAL",
            join.toSql(),
            where(TableTag.TRACES, projectId, filters, parameters));

        return build(DashboardMetric.TOTAL_TRACES, sql, parameters);
    }

    /**
     * Total cost and usage per model, most expensive first
     */
    public MetricQuery observationsCostByModel(String projectId, FilterState state) {
        FilterList filters = filterFactory.create(state);
        JoinPlan join = joinPlanner.plan(TableTag.OBSERVATIONS, filters, JoinPolicy.leftOnDemand(TableTag.TRACES));
        QueryParameters parameters = new QueryParameters();

        String sql = compose(
            "SELECT o.provided_model_name AS name,",
            "  sumMap(o.cost_details)['total'] AS sum_cost_details,",
            "  sumMap(o.usage_details)['total'] AS sum_usage_details",
            "FROM observations o FINAL",
            join.toSql(),
            where(TableTag.OBSERVATIONS, projectId, filters, parameters),
            "GROUP BY o.provided_model_name",
            "ORDER BY sumMap(o.cost_details)['total'] DESC");

        return build(DashboardMetric.MODEL_COST, sql, parameters);
    }

    /**
     * Count and average value per score name, source and data type.
     *
     * A trace filter inner-joins traces. When the scores are also bounded from
     * below in time, the joined traces are bounded by the same instant minus the
     * widening tolerance.
     */
    public MetricQuery scoreAggregate(String projectId, FilterState state) {
        FilterList filters = filterFactory.create(state);
        JoinPlan join = joinPlanner.plan(TableTag.SCORES, filters,
            JoinPolicy.innerOnDemand(TableTag.TRACES).readFinal());
        Optional<Filter> timeFilter = filters.find(filter -> filter.isLowerBoundOn(TableTag.SCORES, "timestamp"));
        QueryParameters parameters = new QueryParameters();

        String where = where(TableTag.SCORES, projectId, filters, parameters);
        String widening = "";
        if (timeFilter.isPresent() && join.joins(TableTag.TRACES)) {
            widening = "AND " + traceTimestampWidening.toSql((Instant) timeFilter.get().getValue(), parameters);
        }

        String sql = compose(
            "SELECT s.name AS name,",
            "  count(*) AS count,",
            "  avg(s.value) AS avg_value,",
            "  s.source AS source,",
            "  s.data_type AS data_type",
            "FROM scores s FINAL",
            join.toSql(),
            where,
            widening,
            "GROUP BY s.name, s.source, s.data_type",
            "ORDER BY count(*) DESC");

        return build(DashboardMetric.SCORE_AGGREGATE, sql, parameters);
    }

    /**
     * Trace count per time bucket, gap-filled
     */
    public MetricQuery tracesByTime(String projectId, FilterState state, DateTrunc granularity) {
        FilterList filters = filterFactory.create(state);
        JoinPlan join = joinPlanner.plan(TableTag.TRACES, filters, JoinPolicy.none());
        QueryParameters parameters = new QueryParameters();

        String sql = compose(
            "SELECT " + TimeBucketing.selectTruncated(granularity, "t.timestamp", "timestamp") + ",",
            "  count(*) AS count",
            "FROM traces t FINAL",
            join.toSql(),
            where(TableTag.TRACES, projectId, filters, parameters),
            "GROUP BY timestamp",
            TimeBucketing.orderByWithFill(granularity, "timestamp"));

        return build(DashboardMetric.TRACES_BY_TIME, sql, parameters);
    }

    /**
     * Usage and cost per time bucket and model, gap-filled
     */
    public MetricQuery observationUsageByTime(String projectId, FilterState state, DateTrunc granularity) {
        FilterList filters = filterFactory.create(state);
        JoinPlan join = joinPlanner.plan(TableTag.OBSERVATIONS, filters, JoinPolicy.leftOnDemand(TableTag.TRACES));
        QueryParameters parameters = new QueryParameters();

        String sql = compose(
            "SELECT " + TimeBucketing.selectTruncated(granularity, "o.start_time", "start_time") + ",",
            "  sumMap(o.usage_details)['total'] AS sum_usage_details,",
            "  sumMap(o.cost_details)['total'] AS sum_cost_details,",
            "  o.provided_model_name AS provided_model_name",
            "FROM observations o FINAL",
            join.toSql(),
            where(TableTag.OBSERVATIONS, projectId, filters, parameters),
            "GROUP BY start_time, provided_model_name",
            TimeBucketing.orderByWithFill(granularity, "start_time"));

        return build(DashboardMetric.MODEL_USAGE_BY_TIME, sql, parameters);
    }

    /**
     * Model names observed in the project
     */
    public MetricQuery distinctModels(String projectId, FilterState state) {
        FilterList filters = filterFactory.create(state);
        JoinPlan join = joinPlanner.plan(TableTag.OBSERVATIONS, filters, JoinPolicy.leftOnDemand(TableTag.TRACES));
        QueryParameters parameters = new QueryParameters();

        String sql = compose(
            "SELECT distinct(o.provided_model_name) AS model",
            "FROM observations o FINAL",
            join.toSql(),
            where(TableTag.OBSERVATIONS, projectId, filters, parameters));

        return build(DashboardMetric.DISTINCT_MODELS, sql, parameters);
    }

    /**
     * Usage and cost per end user.
     *
     * The user id lives on the trace, so traces are always inner-joined and traces
     * without a user are excluded. An observation start time lower bound widens to
     * the joined traces.
     */
    public MetricQuery modelUsageByUser(String projectId, FilterState state) {
        FilterList filters = filterFactory.create(state);
        JoinPlan join = joinPlanner.plan(TableTag.OBSERVATIONS, filters, JoinPolicy.innerAlways(TableTag.TRACES));
        Optional<Filter> timeFilter =
            filters.find(filter -> filter.isLowerBoundOn(TableTag.OBSERVATIONS, "start_time"));
        QueryParameters parameters = new QueryParameters();

        String where = where(TableTag.OBSERVATIONS, projectId, filters, parameters);
        String widening = timeFilter
            .map(filter -> "AND " + traceTimestampWidening.toSql((Instant) filter.getValue(), parameters))
            .orElse("");

        String sql = compose(
            "SELECT sumMap(o.usage_details)['total'] AS sum_usage_details,",
            "  sumMap(o.cost_details)['total'] AS sum_cost_details,",
            "  t.user_id AS user_id",
            "FROM observations o FINAL",
            join.toSql(),
            where,
            "AND t.user_id IS NOT NULL",
            widening,
            "GROUP BY t.user_id");

        return build(DashboardMetric.MODEL_USAGE_BY_USER, sql, parameters);
    }

    /**
     * Project scope followed by the compiled filters. Binds the project id first,
     * then the filter parameters.
     */
    private static String where(TableTag base, String projectId, FilterList filters, QueryParameters parameters) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("Project ID must not be null or empty");
        }
        String project = parameters.bind(PROJECT_ID, "String", projectId);
        AppliedFilter applied = filters.apply();
        parameters.include(applied);
        return "WHERE " + base.qualify("project_id") + " = " + project + "\nAND " + applied.getQuery();
    }

    /**
     * Join SQL clauses line by line, skipping the ones a metric left empty
     */
    private static String compose(String... clauses) {
        List<String> lines = new ArrayList<>(clauses.length);
        for (String clause : clauses) {
            if (clause != null && !clause.isEmpty()) {
                lines.add(clause);
            }
        }
        return String.join("\n", lines);
    }

    private static MetricQuery build(DashboardMetric metric, String sql, QueryParameters parameters) {
        MetricQuery query = new MetricQuery(metric, sql, parameters.asMap());
        log.debug("Composed {} query with parameters {}:\n{}", metric.getValue(), query.getParams().keySet(), sql);
        return query;
    }
}
