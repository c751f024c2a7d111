package com.lantern.dashboard;

import com.lantern.domain.ModelCost;
import com.lantern.domain.ModelUsageTimeBucket;
import com.lantern.domain.ScoreAggregate;
import com.lantern.domain.TraceCount;
import com.lantern.domain.TraceTimeBucket;
import com.lantern.domain.UserModelUsage;
import com.lantern.filter.FilterCondition;
import com.lantern.filter.FilterState;
import com.lantern.filter.ColumnFixtures;
import com.lantern.filter.UnknownFieldException;
import com.lantern.filter.UnsupportedOperatorException;
import com.lantern.query.DashboardQueryBuilder;
import com.lantern.query.DateTrunc;
import com.lantern.query.JoinPlanner;
import com.lantern.query.TraceTimestampWidening;
import com.lantern.storage.EventStoreClient;
import com.lantern.storage.StoreExecutionException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DashboardRepository
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("DashboardRepository Tests")
class DashboardRepositoryTest {

    private static final String PROJECT = "proj1";

    @Mock
    private EventStoreClient eventStore;

    private DashboardQueryMetrics metrics;
    private DashboardRepository repository;

    @BeforeEach
    void setUp() {
        metrics = new DashboardQueryMetrics(new SimpleMeterRegistry());
        DashboardQueryBuilder builder = new DashboardQueryBuilder(
            ColumnFixtures.filterFactory(), new JoinPlanner(), new TraceTimestampWidening());
        repository = new DashboardRepository(builder, eventStore, metrics);
    }

    @Test
    @DisplayName("Total traces should return the count of matching traces")
    void totalTraces() {
        // Given: The store reports five traces
        when(eventStore.execute(anyString(), anyMap())).thenReturn(List.of(Map.of("count", "5")));

        // When
        Optional<TraceCount> count = repository.getTotalTraces(PROJECT, FilterState.empty());

        // Then: The count is returned, the project is bound and the query is counted
        assertThat(count).contains(new TraceCount(5));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(eventStore).execute(anyString(), params.capture());
        assertThat(params.getValue()).containsEntry("projectId", PROJECT);
        assertThat(metrics.getQueriesExecuted().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Total traces should be empty when the store returns no row")
    void totalTracesWithoutRows() {
        // Given: The store returns no row
        when(eventStore.execute(anyString(), anyMap())).thenReturn(List.of());

        // When
        Optional<TraceCount> count = repository.getTotalTraces(PROJECT, FilterState.empty());

        // Then
        assertThat(count).isEmpty();
    }

    @Test
    @DisplayName("Traces by hour should return the truncated bucket of a 10:15 trace")
    void tracesByHour() {
        // Given: The store returns the hour bucket of a 10:15 trace
        when(eventStore.execute(anyString(), anyMap()))
            .thenReturn(List.of(Map.of("timestamp", "2024-01-01 10:00:00", "count", 1L)));

        // When
        List<TraceTimeBucket> buckets = repository.groupTracesByTime(PROJECT, FilterState.empty(), DateTrunc.HOUR);

        // Then: The bucket is read as 10:00 UTC
        assertThat(buckets).containsExactly(new TraceTimeBucket(Instant.parse("2024-01-01T10:00:00Z"), 1));
    }

    @Test
    @DisplayName("Traces by day should keep gap-filled days in ascending order")
    void tracesByDayWithGap() {
        // Given: Three days where the middle one was gap-filled with zero
        when(eventStore.execute(anyString(), anyMap())).thenReturn(List.of(
            Map.of("timestamp", "2024-01-01 00:00:00", "count", "3"),
            Map.of("timestamp", "2024-01-02 00:00:00", "count", "0"),
            Map.of("timestamp", "2024-01-03 00:00:00", "count", "2")));

        // When
        List<TraceTimeBucket> buckets = repository.groupTracesByTime(PROJECT, FilterState.empty(), DateTrunc.DAY);

        // Then: Counts keep the store's ascending order
        assertThat(buckets).extracting(TraceTimeBucket::getCountTraceId).containsExactly(3L, 0L, 2L);
        assertThat(buckets).extracting(TraceTimeBucket::getTimestamp).isSorted();
    }

    @Test
    @DisplayName("Distinct models should not contain duplicates or nulls")
    void distinctModels() {
        // Given: Rows with a repeated model and a null model
        Map<String, Object> nullModel = new HashMap<>();
        nullModel.put("model", null);
        when(eventStore.execute(anyString(), anyMap())).thenReturn(List.of(
            Map.of("model", "gpt-4"), Map.of("model", "claude"), Map.of("model", "gpt-4"), nullModel));

        // When
        List<String> models = repository.getDistinctModels(PROJECT, FilterState.empty());

        // Then: Models appear once in first-seen order
        assertThat(models).containsExactly("gpt-4", "claude");
    }

    @Test
    @DisplayName("Usage by user should drop rows without a user")
    void usageByUserExcludesNullUsers() {
        // Given: One row for alice and one without a user
        Map<String, Object> anonymous = new HashMap<>();
        anonymous.put("user_id", null);
        anonymous.put("sum_usage_details", "10");
        anonymous.put("sum_cost_details", "0.1");
        when(eventStore.execute(anyString(), anyMap())).thenReturn(List.of(
            Map.of("user_id", "alice", "sum_usage_details", "100", "sum_cost_details", "1.5"),
            anonymous));

        // When
        List<UserModelUsage> usage = repository.getModelUsageByUser(PROJECT, FilterState.empty());

        // Then: Only alice is reported and the query counts as executed once
        assertThat(usage).containsExactly(new UserModelUsage(new BigDecimal("100"), new BigDecimal("1.5"), "alice"));
        assertThat(metrics.getQueriesExecuted().count()).isEqualTo(1.0);
        assertThat(metrics.getResultSize().totalAmount()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Cost by model and usage by time should reshape decimal sums")
    void reshapesObservationMetrics() {
        // Given: One cost row followed by one usage row
        when(eventStore.execute(anyString(), anyMap()))
            .thenReturn(List.of(Map.of("name", "gpt-4", "sum_cost_details", "2.5", "sum_usage_details", 300)))
            .thenReturn(List.of(Map.of("start_time", "2024-01-01 00:00:00", "sum_usage_details", "300",
                "sum_cost_details", "2.5", "provided_model_name", "gpt-4")));

        // When
        List<ModelCost> costs = repository.getObservationsCostGroupedByName(PROJECT, FilterState.empty());
        List<ModelUsageTimeBucket> usage =
            repository.getObservationUsageByTime(PROJECT, FilterState.empty(), DateTrunc.DAY);

        // Then: Decimal sums are read exactly
        assertThat(costs).containsExactly(new ModelCost("gpt-4", new BigDecimal("2.5"), new BigDecimal("300")));
        assertThat(usage).containsExactly(new ModelUsageTimeBucket(Instant.parse("2024-01-01T00:00:00Z"),
            new BigDecimal("300"), new BigDecimal("2.5"), "gpt-4"));
    }

    @Test
    @DisplayName("Score aggregate should reshape counts and averages")
    void scoreAggregate() {
        // Given: One aggregated score row
        when(eventStore.execute(anyString(), anyMap())).thenReturn(List.of(
            Map.of("name", "accuracy", "count", "4", "avg_value", 0.75, "source", "API", "data_type", "NUMERIC")));

        // When
        List<ScoreAggregate> scores = repository.getScoreAggregate(PROJECT, FilterState.empty());

        // Then
        assertThat(scores).containsExactly(new ScoreAggregate("accuracy", 4, 0.75, "API", "NUMERIC"));
    }

    @Test
    @DisplayName("Invalid filters should fail before the store is touched")
    void validationBeforeStore() {
        // Given: An unknown column and an operator the Model column does not support

        // When / Then: Both are rejected
        assertThatThrownBy(() -> repository.getTotalTraces(PROJECT,
            FilterState.of(FilterCondition.of("Nope", "=", "x"))))
            .isInstanceOf(UnknownFieldException.class);
        assertThatThrownBy(() -> repository.getDistinctModels(PROJECT,
            FilterState.of(FilterCondition.of("Model", "contains", "gpt"))))
            .isInstanceOf(UnsupportedOperatorException.class);

        // Then: The store is never called and both rejections are counted
        verifyNoInteractions(eventStore);
        assertThat(metrics.getQueriesRejected().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Store failures should propagate and be counted")
    void storeFailurePropagates() {
        // Given: The store fails
        when(eventStore.execute(anyString(), anyMap()))
            .thenThrow(new StoreExecutionException("ClickHouse query failed"));

        // When / Then: The error propagates and the query counts only as failed
        assertThatThrownBy(() -> repository.getScoreAggregate(PROJECT, FilterState.empty()))
            .isInstanceOf(StoreExecutionException.class);
        assertThat(metrics.getQueriesFailed().count()).isEqualTo(1.0);
        assertThat(metrics.getQueriesExecuted().count()).isZero();
    }

    @Test
    @DisplayName("Malformed store values should fail the whole metric")
    void malformedRowFailsMetric() {
        // Given: A valid row followed by one with an unreadable timestamp
        when(eventStore.execute(anyString(), anyMap())).thenReturn(List.of(
            Map.of("timestamp", "2024-01-01 00:00:00", "count", "1"),
            Map.of("timestamp", "not a time", "count", "1")));

        // When / Then: The whole metric fails and the query counts only as failed
        assertThatThrownBy(() -> repository.groupTracesByTime(PROJECT, FilterState.empty(), DateTrunc.DAY))
            .isInstanceOf(StoreExecutionException.class);
        assertThat(metrics.getQueriesFailed().count()).isEqualTo(1.0);
        assertThat(metrics.getQueriesExecuted().count()).isZero();
        assertThat(metrics.getResultSize().count()).isZero();
    }
}
