package com.lantern.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lantern.filter.ColumnCatalog;
import com.lantern.filter.ColumnDefinition;
import com.lantern.filter.FilterFactory;
import com.lantern.query.JoinPlanner;
import com.lantern.query.TraceTimestampWidening;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;

/**
 * Configuration for the dashboard column catalog and the stateless query
 * composition collaborators built on it
 */
@Configuration
public class ColumnCatalogConfig {
    private static final Logger logger = LoggerFactory.getLogger(ColumnCatalogConfig.class);

    private static final TypeReference<List<ColumnDefinition>> COLUMN_LIST = new TypeReference<>() {
    };

    @Value("${lantern.dashboard.catalog-resource:dashboard-columns.json}")
    private String catalogResource;

    @Value("${lantern.dashboard.trace-timestamp-tolerance-minutes:60}")
    private long traceTimestampToleranceMinutes;

    /**
     * Load the filterable columns once; the catalog is shared read-only afterwards
     */
    @Bean
    public ColumnCatalog columnCatalog() {
        ColumnCatalog catalog = loadCatalog(new ClassPathResource(catalogResource), catalogObjectMapper());
        logger.info("Loaded {} dashboard columns from {}", catalog.size(), catalogResource);
        return catalog;
    }

    @Bean
    public FilterFactory filterFactory(ColumnCatalog columnCatalog) {
        return new FilterFactory(columnCatalog);
    }

    @Bean
    public JoinPlanner joinPlanner() {
        return new JoinPlanner();
    }

    @Bean
    public TraceTimestampWidening traceTimestampWidening() {
        return new TraceTimestampWidening(Duration.ofMinutes(traceTimestampToleranceMinutes));
    }

    static ColumnCatalog loadCatalog(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            throw new IllegalStateException("Dashboard column catalog not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            return new ColumnCatalog(objectMapper.readValue(in, COLUMN_LIST));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dashboard column catalog " + resource.getDescription(), e);
        }
    }

    static ObjectMapper catalogObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        return objectMapper;
    }
}
