package com.lantern.filter;

import java.util.List;

/**
 * Catalog fixture shared by the filter, query and dashboard tests
 */
public final class ColumnFixtures {

    private ColumnFixtures() {
    }

    public static ColumnCatalog catalog() {
        return new ColumnCatalog(List.of(
            new ColumnDefinition("Trace Name", "traceName", TableTag.TRACES, "name", ColumnType.STRING_OPTIONS),
            new ColumnDefinition("Tags", "tags", TableTag.TRACES, "tags", ColumnType.ARRAY_OPTIONS),
            new ColumnDefinition("User", "userId", TableTag.TRACES, "user_id", ColumnType.STRING),
            new ColumnDefinition("Trace Timestamp", "traceTimestamp", TableTag.TRACES, "timestamp",
                ColumnType.DATETIME),
            new ColumnDefinition("Metadata", "metadata", TableTag.TRACES, "metadata", ColumnType.STRING_OBJECT),
            new ColumnDefinition("Bookmarked", "bookmarked", TableTag.TRACES, "bookmarked", ColumnType.BOOLEAN),
            new ColumnDefinition("Model", "model", TableTag.OBSERVATIONS, "provided_model_name",
                ColumnType.STRING_OPTIONS),
            new ColumnDefinition("Observation Start Time", "startTime", TableTag.OBSERVATIONS, "start_time",
                ColumnType.DATETIME),
            new ColumnDefinition("Usage", "usageDetails", TableTag.OBSERVATIONS, "usage_details",
                ColumnType.NUMBER_OBJECT),
            new ColumnDefinition("Score Name", "scoreName", TableTag.SCORES, "name", ColumnType.STRING_OPTIONS),
            new ColumnDefinition("Score Value", "value", TableTag.SCORES, "value", ColumnType.NUMBER),
            new ColumnDefinition("Score Timestamp", "scoreTimestamp", TableTag.SCORES, "timestamp",
                ColumnType.DATETIME)));
    }

    public static FilterFactory filterFactory() {
        return new FilterFactory(catalog());
    }
}
