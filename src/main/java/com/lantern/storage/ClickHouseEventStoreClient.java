package com.lantern.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;

/**
 * {@link EventStoreClient} over the ClickHouse JDBC pool.
 *
 * Named placeholders are rewritten to positional parameters before execution.
 * Failures are not retried here.
 */
@Repository
public class ClickHouseEventStoreClient implements EventStoreClient {

    private static final Logger log = LoggerFactory.getLogger(ClickHouseEventStoreClient.class);

    private final JdbcTemplate jdbcTemplate;

    public ClickHouseEventStoreClient(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Map<String, Object>> execute(String query, Map<String, Object> params) {
        PlaceholderBinder.BoundStatement statement = PlaceholderBinder.bind(query, params);

        long start = System.currentTimeMillis();
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(statement.getSql(), statement.getArguments());
            log.debug("ClickHouse query returned {} rows in {} ms", rows.size(), System.currentTimeMillis() - start);
            return rows;
        } catch (DataAccessException e) {
            log.error("ClickHouse query failed after {} ms: {}", System.currentTimeMillis() - start, e.getMessage(), e);
            throw new StoreExecutionException("ClickHouse query failed", query, e);
        }
    }
}
