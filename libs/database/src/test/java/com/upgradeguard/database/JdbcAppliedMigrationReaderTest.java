package com.upgradeguard.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.upgradeguard.database.JdbcAppliedMigrationReader.BookkeepingTable;
import com.upgradeguard.reconciliation.MigrationId;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("JdbcAppliedMigrationReader")
class JdbcAppliedMigrationReaderTest {

    private final DataSource dataSource = mock(DataSource.class);
    private final Connection connection = mock(Connection.class);
    private final DatabaseMetaData metadata = mock(DatabaseMetaData.class);
    private final ResultSet tables = mock(ResultSet.class);
    private final Statement statement = mock(Statement.class);
    private final ResultSet rows = mock(ResultSet.class);

    @BeforeEach
    void setUp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getMetaData()).thenReturn(metadata);
        when(metadata.storesLowerCaseIdentifiers()).thenReturn(true);
        when(metadata.getTables(isNull(), any(), any(), any())).thenReturn(tables);
        when(connection.createStatement()).thenReturn(statement);
    }

    @Nested
    @DisplayName("Reading history")
    class ReadingHistory {

        @Test
        @DisplayName("maps each row to a migration id")
        void mapsRows() throws SQLException {
            when(tables.next()).thenReturn(true);
            when(statement.executeQuery("SELECT app, name FROM django_migrations"))
                    .thenReturn(rows);
            when(rows.next()).thenReturn(true, true, false);
            when(rows.getString(1)).thenReturn("zerver", "analytics");
            when(rows.getString(2)).thenReturn("0001_initial", "0002_auto");

            var applied =
                    new JdbcAppliedMigrationReader(dataSource, BookkeepingTable.DJANGO)
                            .readApplied();

            assertThat(applied)
                    .containsExactlyInAnyOrder(
                            MigrationId.of("zerver", "0001_initial"),
                            MigrationId.of("analytics", "0002_auto"));
            verify(rows).close();
            verify(connection).close();
        }

        @Test
        @DisplayName("a row without a namespace is reported with its position")
        void rejectsIncompleteRow() throws SQLException {
            when(tables.next()).thenReturn(true);
            when(statement.executeQuery("SELECT app, name FROM django_migrations"))
                    .thenReturn(rows);
            when(rows.next()).thenReturn(true, true, false);
            when(rows.getString(1)).thenReturn("zerver", null);
            when(rows.getString(2)).thenReturn("0001_initial", "0002_auto");

            var reader = new JdbcAppliedMigrationReader(dataSource, BookkeepingTable.DJANGO);

            assertThatThrownBy(reader::readApplied)
                    .isInstanceOf(MigrationSourceException.class)
                    .hasMessageContaining("row 2")
                    .hasMessageContaining("django_migrations")
                    .hasMessageContaining("0002_auto")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
            verify(connection).close();
        }

        @Test
        @DisplayName("missing table means a fresh install with nothing applied")
        void missingTableIsFreshInstall() throws SQLException {
            when(tables.next()).thenReturn(false);

            var applied =
                    new JdbcAppliedMigrationReader(dataSource, BookkeepingTable.DJANGO)
                            .readApplied();

            assertThat(applied).isEmpty();
            verify(connection, never()).createStatement();
        }

        @Test
        @DisplayName("looks the table up using the database's identifier case")
        void normalizesIdentifierCase() throws SQLException {
            when(metadata.storesLowerCaseIdentifiers()).thenReturn(false);
            when(metadata.storesUpperCaseIdentifiers()).thenReturn(true);
            when(tables.next()).thenReturn(false);
            var table = new BookkeepingTable("Public", "Schema_History", "ns", "name");

            new JdbcAppliedMigrationReader(dataSource, table).readApplied();

            verify(metadata).getTables(isNull(), eq("PUBLIC"), eq("SCHEMA_HISTORY"), any());
        }

        @Test
        @DisplayName("looks the table up literally in the connection's current schema")
        void escapesPatternAndUsesCurrentSchema() throws SQLException {
            when(metadata.getSearchStringEscape()).thenReturn("\\");
            when(connection.getSchema()).thenReturn("public");
            when(tables.next()).thenReturn(false);

            new JdbcAppliedMigrationReader(dataSource, BookkeepingTable.DJANGO).readApplied();

            verify(metadata).getTables(isNull(), eq("public"), eq("django\\_migrations"), any());
        }

        @Test
        @DisplayName("escapes a configured schema too")
        void escapesConfiguredSchema() throws SQLException {
            when(metadata.getSearchStringEscape()).thenReturn("\\");
            when(tables.next()).thenReturn(false);
            var table = new BookkeepingTable("app_data", "history", "ns", "name");

            new JdbcAppliedMigrationReader(dataSource, table).readApplied();

            verify(metadata).getTables(isNull(), eq("app\\_data"), eq("history"), any());
            verify(connection, never()).getSchema();
        }

        @Test
        @DisplayName("wraps query failures")
        void wrapsQueryFailure() throws SQLException {
            when(tables.next()).thenReturn(true);
            when(statement.executeQuery(any())).thenThrow(new SQLException("permission denied"));

            var reader = new JdbcAppliedMigrationReader(dataSource, BookkeepingTable.DJANGO);

            assertThatThrownBy(reader::readApplied)
                    .isInstanceOf(MigrationSourceException.class)
                    .hasMessageContaining("django_migrations")
                    .hasRootCauseMessage("permission denied");
        }
    }

    @Nested
    @DisplayName("BookkeepingTable")
    class Tables {

        @Test
        @DisplayName("builds a schema-qualified query")
        void schemaQualifiedQuery() {
            var table = new BookkeepingTable("zulip", "django_migrations", "app", "name");

            assertThat(table.name()).isEqualTo("zulip.django_migrations");
            assertThat(table.selectSql())
                    .isEqualTo("SELECT app, name FROM zulip.django_migrations");
        }

        @Test
        @DisplayName("blank schema means none")
        void blankSchema() {
            assertThat(new BookkeepingTable(" ", "t", "a", "b").schema()).isNull();
        }

        @Test
        @DisplayName("rejects identifiers that are not plain SQL names")
        void rejectsUnsafeIdentifiers() {
            assertThatThrownBy(
                            () ->
                                    new BookkeepingTable(
                                            null, "django_migrations; DROP TABLE x", "app", "name"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("table");
            assertThatThrownBy(() -> new BookkeepingTable(null, "t", "app name", "name"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("namespaceColumn");
        }
    }
}
