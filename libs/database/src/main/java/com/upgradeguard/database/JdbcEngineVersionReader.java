package com.upgradeguard.database;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the engine major version from JDBC metadata. For PostgreSQL this is the number before the
 * first dot of {@code server_version} (10 and later).
 */
public class JdbcEngineVersionReader implements EngineVersionReader {

    private static final Logger log = LoggerFactory.getLogger(JdbcEngineVersionReader.class);

    private final DataSource dataSource;

    public JdbcEngineVersionReader(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    }

    @Override
    public int readMajorVersion() {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metadata = connection.getMetaData();
            int major = metadata.getDatabaseMajorVersion();
            log.debug(
                    "Connected to {} {} (major version {})",
                    metadata.getDatabaseProductName(),
                    metadata.getDatabaseProductVersion(),
                    major);
            return major;
        } catch (SQLException e) {
            throw new MigrationSourceException("Failed to read the database engine version", e);
        }
    }
}
