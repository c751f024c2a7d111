package com.lantern.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Headline metrics of a project's dashboard, each loaded independently
 */
public final class DashboardOverview {

    @JsonProperty("totalTraces")
    private final MetricOutcome<Optional<TraceCount>> totalTraces;

    @JsonProperty("modelCosts")
    private final MetricOutcome<List<ModelCost>> modelCosts;

    @JsonProperty("scores")
    private final MetricOutcome<List<ScoreAggregate>> scores;

    @JsonProperty("tracesByTime")
    private final MetricOutcome<List<TraceTimeBucket>> tracesByTime;

    @JsonProperty("modelUsageByTime")
    private final MetricOutcome<List<ModelUsageTimeBucket>> modelUsageByTime;

    @JsonProperty("models")
    private final MetricOutcome<List<String>> models;

    @JsonProperty("usageByUser")
    private final MetricOutcome<List<UserModelUsage>> usageByUser;

    public DashboardOverview(
            MetricOutcome<Optional<TraceCount>> totalTraces,
            MetricOutcome<List<ModelCost>> modelCosts,
            MetricOutcome<List<ScoreAggregate>> scores,
            MetricOutcome<List<TraceTimeBucket>> tracesByTime,
            MetricOutcome<List<ModelUsageTimeBucket>> modelUsageByTime,
            MetricOutcome<List<String>> models,
            MetricOutcome<List<UserModelUsage>> usageByUser) {
        this.totalTraces = totalTraces;
        this.modelCosts = modelCosts;
        this.scores = scores;
        this.tracesByTime = tracesByTime;
        this.modelUsageByTime = modelUsageByTime;
        this.models = models;
        this.usageByUser = usageByUser;
    }

    public MetricOutcome<Optional<TraceCount>> getTotalTraces() {
        return totalTraces;
    }

    public MetricOutcome<List<ModelCost>> getModelCosts() {
        return modelCosts;
    }

    public MetricOutcome<List<ScoreAggregate>> getScores() {
        return scores;
    }

    public MetricOutcome<List<TraceTimeBucket>> getTracesByTime() {
        return tracesByTime;
    }

    public MetricOutcome<List<ModelUsageTimeBucket>> getModelUsageByTime() {
        return modelUsageByTime;
    }

    public MetricOutcome<List<String>> getModels() {
        return models;
    }

    public MetricOutcome<List<UserModelUsage>> getUsageByUser() {
        return usageByUser;
    }

    /**
     * Whether every metric of the overview loaded
     */
    public boolean isComplete() {
        return totalTraces.isSuccess() && modelCosts.isSuccess() && scores.isSuccess()
            && tracesByTime.isSuccess() && modelUsageByTime.isSuccess() && models.isSuccess()
            && usageByUser.isSuccess();
    }
}
