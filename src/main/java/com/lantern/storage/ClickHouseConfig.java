package com.lantern.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Configuration for the ClickHouse JDBC connection pool backing the event store
 */
@Configuration
public class ClickHouseConfig {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseConfig.class);

    @Value("${lantern.storage.clickhouse.url:jdbc:clickhouse://localhost:8123/default}")
    private String url;

    @Value("${lantern.storage.clickhouse.username:default}")
    private String username;

    @Value("${lantern.storage.clickhouse.password:}")
    private String password;

    @Value("${lantern.storage.clickhouse.pool.size:10}")
    private int poolSize;

    @Value("${lantern.storage.clickhouse.max-execution-seconds:300}")
    private int maxExecutionSeconds;

    /**
     * Create ClickHouse DataSource with connection pooling
     */
    @Bean(name = "clickHouseDataSource")
    public DataSource clickHouseDataSource() {
        try {
            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(url);
            config.setUsername(username);
            config.setPassword(password);
            config.setDriverClassName("com.clickhouse.jdbc.ClickHouseDriver");
            config.setPoolName("lantern-clickhouse");

            config.setMaximumPoolSize(poolSize);
            config.setMinimumIdle(2);
            config.setConnectionTimeout(30000);
            config.setIdleTimeout(600000);
            config.setMaxLifetime(1800000);

            // ClickHouse-specific settings
            config.addDataSourceProperty("socket_timeout", String.valueOf(maxExecutionSeconds * 1000L));
            config.addDataSourceProperty("compress", "true");
            config.addDataSourceProperty("max_execution_time", String.valueOf(maxExecutionSeconds));

            HikariDataSource dataSource = new HikariDataSource(config);

            logger.info("ClickHouse DataSource initialized: {} (pool size {})", url, poolSize);
            return dataSource;

        } catch (Exception e) {
            logger.error("Failed to initialize ClickHouse DataSource", e);
            throw new IllegalStateException("ClickHouse DataSource initialization failed", e);
        }
    }

    @Bean(name = "clickHouseJdbcTemplate")
    public JdbcTemplate clickHouseJdbcTemplate(@Qualifier("clickHouseDataSource") DataSource clickHouseDataSource) {
        return new JdbcTemplate(clickHouseDataSource);
    }
}
