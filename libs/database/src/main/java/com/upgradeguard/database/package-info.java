/**
 * Live-database readers for the upgrade check.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.upgradeguard.database.JdbcEngineVersionReader}: engine major version from JDBC
 *       metadata
 *   <li>{@link com.upgradeguard.database.JdbcAppliedMigrationReader}: applied set from a {@code
 *       (namespace, name)} bookkeeping table
 *   <li>{@link com.upgradeguard.database.FlywayAppliedMigrationReader}: applied set from Flyway's
 *       schema history
 *   <li>{@link com.upgradeguard.database.DatabaseSourceConfig}: Spring {@code @Configuration}
 *       selecting the reader from {@link com.upgradeguard.database.DatabaseSourceProperties}
 * </ul>
 */
package com.upgradeguard.database;
