package com.lantern.query;

import com.lantern.filter.FilterCondition;
import com.lantern.filter.FilterState;
import com.lantern.filter.QueryParameters;
import com.lantern.filter.ColumnFixtures;
import com.lantern.filter.UnknownFieldException;
import com.lantern.filter.UnsupportedTableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for DashboardQueryBuilder
 */
@DisplayName("DashboardQueryBuilder Tests")
class DashboardQueryBuilderTest {

    private static final String PROJECT = "proj1";

    private DashboardQueryBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DashboardQueryBuilder(ColumnFixtures.filterFactory(), new JoinPlanner(),
            new TraceTimestampWidening());
    }

    @Test
    @DisplayName("Total traces should count project traces with a tautological filter")
    void totalTraces() {
        // Given: No filter conditions

        // When
        MetricQuery query = builder.totalTraces(PROJECT, FilterState.empty());

        // Then: The statement counts project traces and binds only the project id
        assertThat(query.getMetric()).isEqualTo(DashboardMetric.TOTAL_TRACES);
        assertThat(query.getSql()).isEqualTo(String.join("\n",
            "SELECT count(t.id) AS count",
            "FROM traces t FINAL",
            "WHERE t.project_id = {projectId: String}",
            "AND 1 = 1"));
        assertThat(query.getParams()).containsOnlyKeys("projectId").containsEntry("projectId", PROJECT);
    }

    @Test
    @DisplayName("Blank project id should be rejected")
    void blankProject() {
        // Given: A blank and a missing project id

        // When / Then: Composition refuses both
        assertThatThrownBy(() -> builder.totalTraces(" ", FilterState.empty()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.distinctModels(null, FilterState.empty()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Validation errors should surface from composition")
    void validationErrors() {
        // Given: An unknown column and an observation column on a trace metric

        // When / Then: Each fails with its own validation error
        assertThatThrownBy(() -> builder.totalTraces(PROJECT,
            FilterState.of(FilterCondition.of("Nope", "=", "x"))))
            .isInstanceOf(UnknownFieldException.class);
        assertThatThrownBy(() -> builder.totalTraces(PROJECT,
            FilterState.of(FilterCondition.of("Model", "any of", List.of("gpt-4")))))
            .isInstanceOf(UnsupportedTableException.class);
    }

    @Nested
    @DisplayName("Observation metrics")
    class ObservationMetrics {

        @Test
        @DisplayName("Cost by model should not join traces without a trace filter")
        void costWithoutJoin() {
            // Given: Only an observation filter

            // When
            MetricQuery query = builder.observationsCostByModel(PROJECT,
                FilterState.of(FilterCondition.of("Model", "any of", List.of("gpt-4"))));

            // Then: Observations are read alone
            assertThat(query.getSql())
                .contains("sumMap(o.cost_details)['total'] AS sum_cost_details")
                .contains("FROM observations o FINAL")
                .contains("AND o.provided_model_name IN {filter_provided_model_name_0: Array(String)}")
                .contains("GROUP BY o.provided_model_name")
                .doesNotContain("traces");
        }

        @Test
        @DisplayName("Cost by model should left join traces for a trace filter")
        void costWithJoin() {
            // Given: A filter on the trace's user

            // When
            MetricQuery query = builder.observationsCostByModel(PROJECT,
                FilterState.of(FilterCondition.of("User", "=", "alice")));

            // Then: Traces are left-joined and filtered
            assertThat(query.getSql())
                .contains("LEFT JOIN traces t ON o.trace_id = t.id AND o.project_id = t.project_id")
                .contains("AND t.user_id = {filter_user_id_0: String}");
        }

        @Test
        @DisplayName("Usage by time should bucket and gap-fill start times")
        void usageByTime() {
            // Given: Daily granularity and no filter

            // When
            MetricQuery query = builder.observationUsageByTime(PROJECT, FilterState.empty(), DateTrunc.DAY);

            // Then: Start times are truncated to the day and gaps filled
            assertThat(query.getSql())
                .startsWith("SELECT toStartOfDay(o.start_time) AS start_time,")
                .contains("GROUP BY start_time, provided_model_name")
                .endsWith("ORDER BY start_time ASC WITH FILL STEP toIntervalDay(1)");
        }

        @Test
        @DisplayName("Distinct models should select distinct model names")
        void distinctModels() {
            // Given: No filter conditions

            // When
            MetricQuery query = builder.distinctModels(PROJECT, FilterState.empty());

            // Then
            assertThat(query.getSql())
                .startsWith("SELECT distinct(o.provided_model_name) AS model")
                .doesNotContain("traces");
        }

        @Test
        @DisplayName("Usage by time should left join traces for a trace filter")
        void usageByTimeWithJoin() {
            // Given: A filter on the trace's user
            FilterState state = FilterState.of(FilterCondition.of("User", "=", "alice"));

            // When
            MetricQuery query = builder.observationUsageByTime(PROJECT, state, DateTrunc.HOUR);

            // Then: Traces are left-joined and the user condition is bound
            assertThat(query.getSql())
                .contains("LEFT JOIN traces t ON o.trace_id = t.id AND o.project_id = t.project_id")
                .contains("AND t.user_id = {filter_user_id_0: String}")
                .endsWith("ORDER BY start_time ASC WITH FILL STEP toIntervalHour(1)");
            assertThat(query.getParams()).containsEntry("filter_user_id_0", "alice");
            assertPlaceholdersBound(query);
        }

        @Test
        @DisplayName("Distinct models should left join traces for a trace filter")
        void distinctModelsWithJoin() {
            // Given: A filter on the trace's user
            FilterState state = FilterState.of(FilterCondition.of("User", "=", "alice"));

            // When
            MetricQuery query = builder.distinctModels(PROJECT, state);

            // Then: Traces are left-joined and the user condition is bound
            assertThat(query.getSql())
                .startsWith("SELECT distinct(o.provided_model_name) AS model")
                .contains("LEFT JOIN traces t ON o.trace_id = t.id AND o.project_id = t.project_id")
                .contains("AND t.user_id = {filter_user_id_0: String}");
            assertPlaceholdersBound(query);
        }
    }

    @Nested
    @DisplayName("Usage by user")
    class UsageByUser {

        @Test
        @DisplayName("Should always inner join traces and exclude traces without user")
        void alwaysJoins() {
            // Given: No filter conditions

            // When
            MetricQuery query = builder.modelUsageByUser(PROJECT, FilterState.empty());

            // Then: Traces are inner-joined without widening
            assertThat(query.getSql())
                .contains("JOIN traces t ON o.trace_id = t.id")
                .doesNotContain("LEFT JOIN")
                .contains("AND t.user_id IS NOT NULL")
                .contains("GROUP BY t.user_id")
                .doesNotContain("traceTimestamp");
        }

        @Test
        @DisplayName("Should widen the trace bound from an observation start time lower bound")
        void widensFromStartTime() {
            // Given: A lower bound on observation start time

            // When
            MetricQuery query = builder.modelUsageByUser(PROJECT, FilterState.of(
                FilterCondition.of("Observation Start Time", ">=", "2024-01-01T00:00:00Z")));

            // Then: Joined traces are bounded an hour before the same instant
            assertThat(query.getSql())
                .contains("AND t.timestamp >= {traceTimestamp: DateTime64(3)} - INTERVAL 1 HOUR");
            assertThat(query.getParams()).containsEntry("traceTimestamp", "2024-01-01 00:00:00.000");
            assertPlaceholdersBound(query);
        }

        @Test
        @DisplayName("Upper bounds on start time should not widen")
        void upperBoundDoesNotWiden() {
            // Given: An upper bound on observation start time

            // When
            MetricQuery query = builder.modelUsageByUser(PROJECT, FilterState.of(
                FilterCondition.of("Observation Start Time", "<", "2024-01-01T00:00:00Z")));

            // Then
            assertThat(query.getSql()).doesNotContain("traceTimestamp");
        }
    }

    @Nested
    @DisplayName("Score aggregate")
    class ScoreAggregateQuery {

        @Test
        @DisplayName("Should read scores without join when only score filters are present")
        void noJoin() {
            // Given: Only a score time filter

            // When
            MetricQuery query = builder.scoreAggregate(PROJECT, FilterState.of(
                FilterCondition.of("Score Timestamp", ">", "2024-01-01T00:00:00Z")));

            // Then: Scores are read alone without widening
            assertThat(query.getSql())
                .contains("FROM scores s FINAL")
                .contains("GROUP BY s.name, s.source, s.data_type")
                .doesNotContain("JOIN")
                .doesNotContain("traceTimestamp");
        }

        @Test
        @DisplayName("Should widen when a trace join and a score time lower bound are both present")
        void widensWithJoin() {
            // Given: A score time lower bound and a trace filter

            // When
            MetricQuery query = builder.scoreAggregate(PROJECT, FilterState.of(
                FilterCondition.of("Score Timestamp", ">", "2024-01-01T10:00:00Z"),
                FilterCondition.of("User", "=", "alice")));

            // Then: Traces are joined and bounded an hour before the score bound
            assertThat(query.getSql())
                .contains("JOIN traces t FINAL ON s.trace_id = t.id AND s.project_id = t.project_id")
                .contains("AND t.timestamp >= {traceTimestamp: DateTime64(3)} - INTERVAL 1 HOUR");
            assertPlaceholdersBound(query);
        }

        @Test
        @DisplayName("Should join traces without widening when no score time bound is present")
        void joinsWithoutWidening() {
            // Given: A trace filter and no score time filter
            FilterState state = FilterState.of(FilterCondition.of("User", "=", "alice"));

            // When
            MetricQuery query = builder.scoreAggregate(PROJECT, state);

            // Then: Traces are joined but not bounded in time
            assertThat(query.getSql())
                .contains("JOIN traces t FINAL ON s.trace_id = t.id AND s.project_id = t.project_id")
                .contains("AND t.user_id = {filter_user_id_0: String}")
                .doesNotContain("traceTimestamp")
                .doesNotContain("INTERVAL");
            assertThat(query.getParams()).doesNotContainKey("traceTimestamp");
            assertPlaceholdersBound(query);
        }
    }

    @Test
    @DisplayName("Traces by time should bucket trace timestamps")
    void tracesByTime() {
        // Given: Hourly granularity and no filter

        // When
        MetricQuery query = builder.tracesByTime(PROJECT, FilterState.empty(), DateTrunc.HOUR);

        // Then
        assertThat(query.getSql()).isEqualTo(String.join("\n",
            "SELECT toStartOfHour(t.timestamp) AS timestamp,",
            "  count(*) AS count",
            "FROM traces t FINAL",
            "WHERE t.project_id = {projectId: String}",
            "AND 1 = 1",
            "GROUP BY timestamp",
            "ORDER BY timestamp ASC WITH FILL STEP toIntervalHour(1)"));
    }

    @Test
    @DisplayName("Missing granularity should fail composition")
    void nullGranularity() {
        // Given / When / Then: A null granularity is refused
        assertThatThrownBy(() -> builder.tracesByTime(PROJECT, FilterState.empty(), null))
            .isInstanceOf(NullPointerException.class);
    }

    private static void assertPlaceholdersBound(MetricQuery query) {
        List<String> names = new ArrayList<>();
        Matcher matcher = QueryParameters.PLACEHOLDER.matcher(query.getSql());
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        assertThat(names).doesNotHaveDuplicates().containsExactlyInAnyOrderElementsOf(query.getParams().keySet());
    }
}
