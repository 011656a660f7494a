package com.upgradeguard.database;

import com.upgradeguard.reconciliation.MigrationId;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads applied migrations from a bookkeeping table holding one {@code (namespace, name)} row per
 * applied migration, such as Django's {@code django_migrations(app, name)}.
 *
 * <p>If the table does not exist the database has never been migrated: it is a fresh install and
 * the applied set is empty. Without a configured schema the table is looked up in the
 * connection's current schema, the one an unqualified {@code SELECT} resolves against.
 *
 * <p>Table and column names come from configuration and must be plain SQL identifiers; the table
 * may be schema-qualified.
 */
public class JdbcAppliedMigrationReader implements AppliedMigrationReader {

    private static final Logger log = LoggerFactory.getLogger(JdbcAppliedMigrationReader.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final DataSource dataSource;
    private final BookkeepingTable table;

    public JdbcAppliedMigrationReader(DataSource dataSource, BookkeepingTable table) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    @Override
    public Set<MigrationId> readApplied() {
        try (Connection connection = dataSource.getConnection()) {
            if (!tableExists(connection)) {
                log.debug(
                        "Table {} does not exist; treating the database as a fresh install",
                        table.name());
                return Set.of();
            }
            Set<MigrationId> applied = new HashSet<>();
            try (Statement statement = connection.createStatement();
                    ResultSet rows = statement.executeQuery(table.selectSql())) {
                int row = 0;
                while (rows.next()) {
                    row++;
                    String namespace = rows.getString(1);
                    String name = rows.getString(2);
                    try {
                        applied.add(new MigrationId(namespace, name));
                    } catch (IllegalArgumentException e) {
                        throw new MigrationSourceException(
                                "Invalid row %d in %s (%s, %s): %s"
                                        .formatted(
                                                row, table.name(), namespace, name, e.getMessage()),
                                e);
                    }
                }
            }
            log.debug("Read {} applied migrations from {}", applied.size(), table.name());
            return applied;
        } catch (SQLException e) {
            throw new MigrationSourceException(
                    "Failed to read applied migrations from " + table.name(), e);
        }
    }

    private boolean tableExists(Connection connection) throws SQLException {
        DatabaseMetaData metadata = connection.getMetaData();
        String schema =
                table.schema() == null
                        ? connection.getSchema()
                        : normalize(metadata, table.schema());
        String escape = metadata.getSearchStringEscape();
        try (ResultSet tables =
                metadata.getTables(
                        null,
                        escapePattern(schema, escape),
                        escapePattern(normalize(metadata, table.table()), escape),
                        new String[] {"TABLE"})) {
            return tables.next();
        }
    }

    // getTables takes LIKE patterns, where '_' and '%' are wildcards.
    private static String escapePattern(String identifier, String escape) {
        if (identifier == null || escape == null || escape.isEmpty()) {
            return identifier;
        }
        StringBuilder escaped = new StringBuilder(identifier.length() + 4);
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (c == '_' || c == '%' || escape.indexOf(c) >= 0) {
                escaped.append(escape);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static String normalize(DatabaseMetaData metadata, String identifier)
            throws SQLException {
        if (metadata.storesLowerCaseIdentifiers()) {
            return identifier.toLowerCase(Locale.ROOT);
        }
        if (metadata.storesUpperCaseIdentifiers()) {
            return identifier.toUpperCase(Locale.ROOT);
        }
        return identifier;
    }

    /**
     * Location and shape of a migration bookkeeping table.
     *
     * @param schema schema holding the table, or null for the connection's search path
     * @param table table name
     * @param namespaceColumn column holding the migration namespace
     * @param nameColumn column holding the migration name
     */
    public record BookkeepingTable(
            String schema, String table, String namespaceColumn, String nameColumn) {

        /** Django's bookkeeping table, {@code django_migrations(app, name)}. */
        public static final BookkeepingTable DJANGO =
                new BookkeepingTable(null, "django_migrations", "app", "name");

        public BookkeepingTable {
            if (schema != null && schema.isBlank()) {
                schema = null;
            }
            if (schema != null) {
                requireIdentifier("schema", schema);
            }
            requireIdentifier("table", table);
            requireIdentifier("namespaceColumn", namespaceColumn);
            requireIdentifier("nameColumn", nameColumn);
        }

        /** Qualified table name as used in SQL. */
        public String name() {
            return schema == null ? table : schema + "." + table;
        }

        String selectSql() {
            return "SELECT " + namespaceColumn + ", " + nameColumn + " FROM " + name();
        }

        private static void requireIdentifier(String field, String value) {
            if (value == null || !IDENTIFIER.matcher(value).matches()) {
                throw new IllegalArgumentException(
                        "%s must be a plain SQL identifier but was '%s'".formatted(field, value));
            }
        }
    }
}
