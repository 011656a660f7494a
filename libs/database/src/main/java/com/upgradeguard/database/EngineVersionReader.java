package com.upgradeguard.database;

/** Reports the major version of the live database engine. */
@FunctionalInterface
public interface EngineVersionReader {

    /**
     * @return engine major version, e.g. {@code 14} for PostgreSQL 14.5
     * @throws MigrationSourceException if the database cannot be reached
     */
    int readMajorVersion();
}
