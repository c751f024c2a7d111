package com.lantern.config;

import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Entry point for applications embedding the dashboard query layer. Importing
 * it registers the catalog, query composition, ClickHouse store and dashboard
 * repository beans. Query metrics go to the host's MeterRegistry when it has
 * one, otherwise to a private SimpleMeterRegistry.
 */
@Configuration
@ComponentScan("com.lantern")
public class DashboardConfiguration {
}
