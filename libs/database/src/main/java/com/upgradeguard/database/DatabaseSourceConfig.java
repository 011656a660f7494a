package com.upgradeguard.database;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for the live-database readers.
 *
 * <p>Exactly one {@link AppliedMigrationReader} is created, selected by {@code
 * upgradeguard.database.applied-source}. Both share the application's {@link DataSource}; nothing
 * here connects until a reader is called.
 *
 * <h2>Excluding Spring Boot Auto-Configuration</h2>
 *
 * <p>This module only reads Flyway's history and must never migrate. Applications using it should
 * disable {@link FlywayAutoConfiguration}, which would otherwise run {@code migrate} on startup:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 */
@Configuration
@EnableConfigurationProperties(DatabaseSourceProperties.class)
public class DatabaseSourceConfig {

    @Bean
    public EngineVersionReader engineVersionReader(DataSource dataSource) {
        return new JdbcEngineVersionReader(dataSource);
    }

    @Bean
    @ConditionalOnProperty(
            prefix = "upgradeguard.database",
            name = "applied-source",
            havingValue = "table",
            matchIfMissing = true)
    public AppliedMigrationReader tableAppliedMigrationReader(
            DataSource dataSource, DatabaseSourceProperties properties) {
        return new JdbcAppliedMigrationReader(dataSource, properties.table().toBookkeepingTable());
    }

    @Bean
    @ConditionalOnProperty(
            prefix = "upgradeguard.database",
            name = "applied-source",
            havingValue = "flyway")
    public AppliedMigrationReader flywayAppliedMigrationReader(
            DataSource dataSource, DatabaseSourceProperties properties) {
        return new FlywayAppliedMigrationReader(
                createFlyway(dataSource, properties.flyway()), properties.flyway().namespace());
    }

    // ── Private Helpers ──

    /** Read-only Flyway handle: clean is disabled and nothing here calls migrate. */
    private Flyway createFlyway(DataSource dataSource, DatabaseSourceProperties.Flyway config) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(config.locations())
                .table(config.historyTable())
                .cleanDisabled(true)
                .load();
    }
}
