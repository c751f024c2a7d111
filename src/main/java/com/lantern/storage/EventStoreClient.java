package com.lantern.storage;

import java.util.List;
import java.util.Map;

/**
 * Executes parameterized analytical queries against the event store.
 *
 * Queries reference parameters with ClickHouse {@code {name: Type}} placeholders;
 * {@code params} supplies a value for each of them. Connection management and
 * any retry policy belong to the implementation.
 */
public interface EventStoreClient {

    /**
     * @return result rows as column name to value maps, in result order
     * @throws StoreExecutionException if the store rejects or fails the query
     */
    List<Map<String, Object>> execute(String query, Map<String, Object> params);
}
