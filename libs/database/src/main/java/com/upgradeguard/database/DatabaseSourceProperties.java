package com.upgradeguard.database;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration describing where the live database keeps its migration history.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * upgradeguard:
 *   database:
 *     applied-source: table
 *     table:
 *       schema: public
 *       name: django_migrations
 *       namespace-column: app
 *       name-column: name
 *     flyway:
 *       namespace: billing
 *       locations: classpath:db/migration
 *       history-table: flyway_schema_history
 * }</pre>
 *
 * <p>The JDBC connection itself is Spring Boot's {@code spring.datasource.*}.
 *
 * @param appliedSource which bookkeeping the applied set is read from
 * @param table bookkeeping-table settings, used when {@code appliedSource} is {@code TABLE}
 * @param flyway Flyway settings, used when {@code appliedSource} is {@code FLYWAY}
 */
@Validated
@ConfigurationProperties(prefix = "upgradeguard.database")
public record DatabaseSourceProperties(
        @NotNull AppliedSource appliedSource, @Valid Table table, @Valid Flyway flyway) {

    public DatabaseSourceProperties {
        if (appliedSource == null) {
            appliedSource = AppliedSource.TABLE;
        }
        if (table == null) {
            table = new Table(null, null, null, null);
        }
        if (flyway == null) {
            flyway = new Flyway(null, null, null);
        }
    }

    /** Supported applied-migration bookkeeping formats. */
    public enum AppliedSource {
        /** A {@code (namespace, name)} table such as {@code django_migrations}. */
        TABLE,
        /** Flyway's schema history table. */
        FLYWAY
    }

    /**
     * Bookkeeping-table settings. Unset fields default to Django's {@code django_migrations}.
     *
     * @param schema schema holding the table (optional)
     * @param name table name
     * @param namespaceColumn column holding the namespace
     * @param nameColumn column holding the migration name
     */
    public record Table(
            String schema,
            @NotBlank String name,
            @NotBlank String namespaceColumn,
            @NotBlank String nameColumn) {

        public Table {
            if (name == null || name.isBlank()) {
                name = "django_migrations";
            }
            if (namespaceColumn == null || namespaceColumn.isBlank()) {
                namespaceColumn = "app";
            }
            if (nameColumn == null || nameColumn.isBlank()) {
                nameColumn = "name";
            }
        }

        public JdbcAppliedMigrationReader.BookkeepingTable toBookkeepingTable() {
            return new JdbcAppliedMigrationReader.BookkeepingTable(
                    schema, name, namespaceColumn, nameColumn);
        }
    }

    /**
     * Flyway settings.
     *
     * @param namespace namespace assigned to every Flyway migration
     * @param locations Flyway migration locations of the target release
     * @param historyTable Flyway's schema history table
     */
    public record Flyway(
            @NotBlank String namespace, @NotBlank String locations, @NotBlank String historyTable) {

        public Flyway {
            if (namespace == null || namespace.isBlank()) {
                namespace = "default";
            }
            if (locations == null || locations.isBlank()) {
                locations = "classpath:db/migration";
            }
            if (historyTable == null || historyTable.isBlank()) {
                historyTable = "flyway_schema_history";
            }
        }
    }
}
