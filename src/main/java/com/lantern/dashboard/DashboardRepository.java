package com.lantern.dashboard;

import com.lantern.domain.ModelCost;
import com.lantern.domain.ModelUsageTimeBucket;
import com.lantern.domain.ScoreAggregate;
import com.lantern.domain.TraceCount;
import com.lantern.domain.TraceTimeBucket;
import com.lantern.domain.UserModelUsage;
import com.lantern.filter.FilterState;
import com.lantern.filter.FilterValidationException;
import com.lantern.query.DashboardQueryBuilder;
import com.lantern.query.DateTrunc;
import com.lantern.query.MetricQuery;
import com.lantern.storage.EventStoreClient;
import com.lantern.storage.RowValues;
import com.lantern.storage.StoreExecutionException;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Dashboard metrics of a project, read from the event store.
 *
 * Every method composes its statement first, so an invalid filter fails before
 * the store is touched, then runs it and reshapes the rows into typed results.
 * A metric either returns its complete result or throws.
 */
@Repository
public class DashboardRepository {

    private static final Logger logger = LoggerFactory.getLogger(DashboardRepository.class);

    private final DashboardQueryBuilder queryBuilder;
    private final EventStoreClient eventStore;
    private final DashboardQueryMetrics metrics;

    public DashboardRepository(
            DashboardQueryBuilder queryBuilder,
            EventStoreClient eventStore,
            DashboardQueryMetrics metrics) {
        this.queryBuilder = queryBuilder;
        this.eventStore = eventStore;
        this.metrics = metrics;
    }

    /**
     * Number of traces matching the filter, empty when the store returned no row
     */
    public Optional<TraceCount> getTotalTraces(String projectId, FilterState filter) {
        MetricQuery query = compose(() -> queryBuilder.totalTraces(projectId, filter));
        List<TraceCount> counts = run(query, row -> new TraceCount(RowValues.getLong(row, "count")));
        return counts.isEmpty() ? Optional.empty() : Optional.of(counts.get(0));
    }

    public List<ModelCost> getObservationsCostGroupedByName(String projectId, FilterState filter) {
        MetricQuery query = compose(() -> queryBuilder.observationsCostByModel(projectId, filter));
        return run(query, row -> new ModelCost(
            RowValues.getString(row, "name"),
            RowValues.getDecimal(row, "sum_cost_details"),
            RowValues.getDecimal(row, "sum_usage_details")));
    }

    public List<ScoreAggregate> getScoreAggregate(String projectId, FilterState filter) {
        MetricQuery query = compose(() -> queryBuilder.scoreAggregate(projectId, filter));
        return run(query, row -> new ScoreAggregate(
            RowValues.getString(row, "name"),
            RowValues.getLong(row, "count"),
            RowValues.getDouble(row, "avg_value"),
            RowValues.getString(row, "source"),
            RowValues.getString(row, "data_type")));
    }

    /**
     * Trace counts per bucket in ascending order. Buckets without traces are
     * present with a count of zero.
     */
    public List<TraceTimeBucket> groupTracesByTime(String projectId, FilterState filter, DateTrunc granularity) {
        MetricQuery query = compose(() -> queryBuilder.tracesByTime(projectId, filter, granularity));
        return run(query, row -> new TraceTimeBucket(
            RowValues.getInstant(row, "timestamp"),
            RowValues.getLong(row, "count")));
    }

    public List<ModelUsageTimeBucket> getObservationUsageByTime(
            String projectId, FilterState filter, DateTrunc granularity) {
        MetricQuery query = compose(() -> queryBuilder.observationUsageByTime(projectId, filter, granularity));
        return run(query, row -> new ModelUsageTimeBucket(
            RowValues.getInstant(row, "start_time"),
            RowValues.getDecimal(row, "sum_usage_details"),
            RowValues.getDecimal(row, "sum_cost_details"),
            RowValues.getString(row, "provided_model_name")));
    }

    /**
     * Model names in first-seen order, without duplicates or nulls
     */
    public List<String> getDistinctModels(String projectId, FilterState filter) {
        MetricQuery query = compose(() -> queryBuilder.distinctModels(projectId, filter));
        Set<String> models = new LinkedHashSet<>();
        for (String model : run(query, row -> RowValues.getString(row, "model"))) {
            if (model != null) {
                models.add(model);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(models));
    }

    /**
     * Usage per end user. Rows without a user id are dropped.
     */
    public List<UserModelUsage> getModelUsageByUser(String projectId, FilterState filter) {
        MetricQuery query = compose(() -> queryBuilder.modelUsageByUser(projectId, filter));
        List<UserModelUsage> usage = new ArrayList<>();
        for (UserModelUsage entry : run(query, DashboardRepository::toUserModelUsage)) {
            if (entry != null) {
                usage.add(entry);
            }
        }
        return Collections.unmodifiableList(usage);
    }

    private static UserModelUsage toUserModelUsage(Map<String, Object> row) {
        String userId = RowValues.getString(row, "user_id");
        if (userId == null) {
            return null;
        }
        return new UserModelUsage(
            RowValues.getDecimal(row, "sum_usage_details"),
            RowValues.getDecimal(row, "sum_cost_details"),
            userId);
    }

    private MetricQuery compose(Supplier<MetricQuery> composer) {
        try {
            return composer.get();
        } catch (FilterValidationException e) {
            metrics.recordQueryRejected();
            logger.warn("Rejected dashboard filter on column '{}': {}", e.getColumn(), e.getMessage());
            throw e;
        } catch (IllegalArgumentException e) {
            metrics.recordQueryRejected();
            logger.warn("Rejected dashboard query: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * A query counts as executed once its rows are fetched and reshaped; a store
     * error or an unreadable row counts it as failed instead.
     */
    private <T> List<T> run(MetricQuery query, Function<Map<String, Object>, T> mapper) {
        Timer.Sample sample = metrics.startQueryTimer();
        try {
            List<Map<String, Object>> rows = eventStore.execute(query.getSql(), query.getParams());
            List<T> results = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                results.add(mapper.apply(row));
            }
            metrics.recordQueryExecuted();
            metrics.recordResultSize(rows.size());
            logger.debug("Metric {} returned {} rows", query.getMetric().getValue(), rows.size());
            return Collections.unmodifiableList(results);
        } catch (StoreExecutionException e) {
            metrics.recordQueryFailed();
            logger.error("Failed to load {}", query.getMetric().getValue(), e);
            throw e;
        } finally {
            metrics.recordQueryLatency(query.getMetric(), sample);
        }
    }
}
