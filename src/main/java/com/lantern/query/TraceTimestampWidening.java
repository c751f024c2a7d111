package com.lantern.query;

import com.lantern.filter.QueryParameters;
import com.lantern.filter.TableTag;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Lenient lower bound on the joined trace's timestamp.
 *
 * Scores and observations can be written well after their parent trace, so the
 * trace bound is the child's lower bound minus a tolerance rather than the exact
 * same instant. The tolerance defaults to one hour and is configured through
 * {@code lantern.dashboard.trace-timestamp-tolerance-minutes}.
 */
public class TraceTimestampWidening {

    public static final String PARAMETER_NAME = "traceTimestamp";

    public static final Duration DEFAULT_TOLERANCE = Duration.ofHours(1);

    private final Duration tolerance;

    public TraceTimestampWidening() {
        this(DEFAULT_TOLERANCE);
    }

    public TraceTimestampWidening(Duration tolerance) {
        Objects.requireNonNull(tolerance, "tolerance");
        if (tolerance.isNegative()) {
            throw new IllegalArgumentException("Trace timestamp tolerance must not be negative: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public Duration getTolerance() {
        return tolerance;
    }

    /**
     * {@code t.timestamp >= {traceTimestamp: DateTime64(3)} - INTERVAL 1 HOUR}
     */
    public String toSql(Instant lowerBound, QueryParameters parameters) {
        String placeholder = parameters.bind(PARAMETER_NAME, "DateTime64(3)", lowerBound);
        return TableTag.TRACES.qualify("timestamp") + " >= " + placeholder + " - " + intervalLiteral();
    }

    String intervalLiteral() {
        long seconds = tolerance.getSeconds();
        if (seconds % 3600 == 0) {
            return "INTERVAL " + seconds / 3600 + " HOUR";
        }
        if (seconds % 60 == 0) {
            return "INTERVAL " + seconds / 60 + " MINUTE";
        }
        return "INTERVAL " + seconds + " SECOND";
    }
}
