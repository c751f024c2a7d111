package com.lantern.dashboard;

import com.lantern.query.DashboardMetric;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Metrics collector for dashboard queries
 * Tracks executed, failed and rejected queries, per-metric latency,
 * and result sizes
 */
@Component
public class DashboardQueryMetrics {

    private final MeterRegistry meterRegistry;

    private Counter queriesExecuted;
    private Counter queriesFailed;
    private Counter queriesRejected;
    private DistributionSummary resultSize;
    private Map<DashboardMetric, Timer> latencies;

    /**
     * Uses the application's registry, or a private {@link SimpleMeterRegistry}
     * when none is defined.
     */
    @Autowired
    public DashboardQueryMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        this(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    public DashboardQueryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        init();
    }

    private void init() {
        queriesExecuted = Counter.builder("lantern.dashboard.query.executed")
            .description("Total number of dashboard queries executed")
            .register(meterRegistry);

        queriesFailed = Counter.builder("lantern.dashboard.query.failed")
            .description("Total number of dashboard queries that failed in the store")
            .register(meterRegistry);

        queriesRejected = Counter.builder("lantern.dashboard.query.rejected")
            .description("Total number of dashboard queries rejected by filter validation")
            .register(meterRegistry);

        resultSize = DistributionSummary.builder("lantern.dashboard.query.result.size")
            .description("Distribution of dashboard query result sizes (number of rows)")
            .baseUnit("rows")
            .register(meterRegistry);

        Map<DashboardMetric, Timer> timers = new EnumMap<>(DashboardMetric.class);
        for (DashboardMetric metric : DashboardMetric.values()) {
            timers.put(metric, Timer.builder("lantern.dashboard.query.latency")
                .description("Latency of dashboard query execution")
                .tag("metric", metric.getValue())
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        }
        latencies = Collections.unmodifiableMap(timers);
    }

    public void recordQueryExecuted() {
        queriesExecuted.increment();
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public void recordQueryRejected() {
        queriesRejected.increment();
    }

    public void recordResultSize(long size) {
        resultSize.record(size);
    }

    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(DashboardMetric metric, Timer.Sample sample) {
        sample.stop(latencies.get(metric));
    }

    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Counter getQueriesRejected() {
        return queriesRejected;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }

    public Timer getQueryLatency(DashboardMetric metric) {
        return latencies.get(metric);
    }
}
