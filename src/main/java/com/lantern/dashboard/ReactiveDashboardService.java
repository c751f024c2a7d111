package com.lantern.dashboard;

import com.lantern.domain.DashboardOverview;
import com.lantern.domain.MetricOutcome;
import com.lantern.domain.ModelCost;
import com.lantern.domain.ModelUsageTimeBucket;
import com.lantern.domain.ScoreAggregate;
import com.lantern.domain.TraceCount;
import com.lantern.domain.TraceTimeBucket;
import com.lantern.domain.UserModelUsage;
import com.lantern.filter.FilterState;
import com.lantern.query.DashboardMetric;
import com.lantern.query.DateTrunc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Non-blocking facade over {@link DashboardRepository}.
 *
 * Each metric runs on the bounded elastic scheduler under its own timeout, so
 * callers can fan several metrics out concurrently. {@link #loadOverview} does
 * exactly that and captures every metric's success or failure separately.
 */
@Service
public class ReactiveDashboardService {

    private static final Logger log = LoggerFactory.getLogger(ReactiveDashboardService.class);

    private final DashboardRepository repository;
    private final Duration timeout;

    @Autowired
    public ReactiveDashboardService(
            DashboardRepository repository,
            @Value("${lantern.dashboard.query-timeout-seconds:30}") long timeoutSeconds) {
        this(repository, Duration.ofSeconds(timeoutSeconds));
    }

    ReactiveDashboardService(DashboardRepository repository, Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Query timeout must be positive: " + timeout);
        }
        this.repository = repository;
        this.timeout = timeout;
    }

    public Mono<Optional<TraceCount>> getTotalTraces(String projectId, FilterState filter) {
        return defer(DashboardMetric.TOTAL_TRACES, () -> repository.getTotalTraces(projectId, filter));
    }

    public Mono<List<ModelCost>> getObservationsCostGroupedByName(String projectId, FilterState filter) {
        return defer(DashboardMetric.MODEL_COST,
            () -> repository.getObservationsCostGroupedByName(projectId, filter));
    }

    public Mono<List<ScoreAggregate>> getScoreAggregate(String projectId, FilterState filter) {
        return defer(DashboardMetric.SCORE_AGGREGATE, () -> repository.getScoreAggregate(projectId, filter));
    }

    public Mono<List<TraceTimeBucket>> groupTracesByTime(
            String projectId, FilterState filter, DateTrunc granularity) {
        return defer(DashboardMetric.TRACES_BY_TIME,
            () -> repository.groupTracesByTime(projectId, filter, granularity));
    }

    public Mono<List<ModelUsageTimeBucket>> getObservationUsageByTime(
            String projectId, FilterState filter, DateTrunc granularity) {
        return defer(DashboardMetric.MODEL_USAGE_BY_TIME,
            () -> repository.getObservationUsageByTime(projectId, filter, granularity));
    }

    public Mono<List<String>> getDistinctModels(String projectId, FilterState filter) {
        return defer(DashboardMetric.DISTINCT_MODELS, () -> repository.getDistinctModels(projectId, filter));
    }

    public Mono<List<UserModelUsage>> getModelUsageByUser(String projectId, FilterState filter) {
        return defer(DashboardMetric.MODEL_USAGE_BY_USER, () -> repository.getModelUsageByUser(projectId, filter));
    }

    /**
     * Load every dashboard metric concurrently.
     *
     * A failing or timed-out metric is reported as a failed outcome. It does not
     * cancel the others, and the returned Mono itself never errors.
     */
    public Mono<DashboardOverview> loadOverview(String projectId, FilterState filter, DateTrunc granularity) {
        return Mono.zip(
                outcome(DashboardMetric.TOTAL_TRACES, getTotalTraces(projectId, filter)),
                outcome(DashboardMetric.MODEL_COST, getObservationsCostGroupedByName(projectId, filter)),
                outcome(DashboardMetric.SCORE_AGGREGATE, getScoreAggregate(projectId, filter)),
                outcome(DashboardMetric.TRACES_BY_TIME, groupTracesByTime(projectId, filter, granularity)),
                outcome(DashboardMetric.MODEL_USAGE_BY_TIME,
                    getObservationUsageByTime(projectId, filter, granularity)),
                outcome(DashboardMetric.DISTINCT_MODELS, getDistinctModels(projectId, filter)),
                outcome(DashboardMetric.MODEL_USAGE_BY_USER, getModelUsageByUser(projectId, filter)))
            .map(results -> new DashboardOverview(
                results.getT1(), results.getT2(), results.getT3(), results.getT4(),
                results.getT5(), results.getT6(), results.getT7()))
            .doOnSuccess(overview -> {
                if (overview != null && !overview.isComplete()) {
                    log.warn("Dashboard overview for project {} loaded with failed metrics", projectId);
                }
            });
    }

    private <T> Mono<T> defer(DashboardMetric metric, Callable<T> call) {
        return Mono.fromCallable(call)
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .doOnError(TimeoutException.class, error ->
                log.warn("Dashboard metric {} timed out after {}s", metric.getValue(), timeout.getSeconds()));
    }

    private static <T> Mono<MetricOutcome<T>> outcome(DashboardMetric metric, Mono<T> result) {
        return result
            .map(MetricOutcome::success)
            .onErrorResume(error -> {
                log.error("Dashboard metric {} failed: {}", metric.getValue(), error.getMessage());
                return Mono.just(MetricOutcome.<T>failure(error));
            });
    }
}
