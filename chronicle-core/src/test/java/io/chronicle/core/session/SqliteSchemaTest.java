package io.chronicle.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteSchemaTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldApplyPragmasAndCreateTablesRepeatedly() throws Exception {
        try (Connection connection = connect()) {
            SqliteSchema.apply(connection, StorageSettings.defaults());
            SqliteSchema.apply(connection, new StorageSettings(2_000, 256));

            assertThat(queryString(connection, "PRAGMA journal_mode")).isEqualToIgnoringCase("wal");
            assertThat(queryInt(connection, "PRAGMA foreign_keys")).isEqualTo(1);
            assertThat(queryInt(connection, "PRAGMA busy_timeout")).isEqualTo(2_000);
            assertThat(queryInt(connection, "PRAGMA cache_size")).isEqualTo(-256);
            assertThat(queryInt(connection,
                "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name IN ('sessions', 'messages')"))
                .isEqualTo(2);
        }
    }

    @Test
    void shouldCascadeMessageDeletionWithSession() throws Exception {
        try (Connection connection = connect(); Statement statement = connection.createStatement()) {
            SqliteSchema.apply(connection, StorageSettings.defaults());
            statement.executeUpdate("INSERT INTO sessions (key, created_at, updated_at) VALUES ('k', 'now', 'now')");
            statement.executeUpdate("""
                INSERT INTO messages (session_key, seq, role, created_at) VALUES ('k', 1, 'user', 'now')
                """);

            statement.executeUpdate("DELETE FROM sessions WHERE key = 'k'");

            assertThat(queryInt(connection, "SELECT COUNT(*) FROM messages")).isZero();
        }
    }

    @Test
    void shouldRejectDuplicateSequenceAndOrphanMessages() throws Exception {
        try (Connection connection = connect(); Statement statement = connection.createStatement()) {
            SqliteSchema.apply(connection, StorageSettings.defaults());
            statement.executeUpdate("INSERT INTO sessions (key, created_at, updated_at) VALUES ('k', 'now', 'now')");
            statement.executeUpdate("INSERT INTO messages (session_key, seq, role, created_at) VALUES ('k', 1, 'user', 'now')");

            assertThatThrownBy(() -> statement.executeUpdate(
                "INSERT INTO messages (session_key, seq, role, created_at) VALUES ('k', 1, 'user', 'now')"))
                .isInstanceOf(SQLException.class);
            assertThatThrownBy(() -> statement.executeUpdate(
                "INSERT INTO messages (session_key, seq, role, created_at) VALUES ('ghost', 1, 'user', 'now')"))
                .isInstanceOf(SQLException.class);
        }
    }

    @Test
    void shouldDefaultOptionalColumns() throws Exception {
        try (Connection connection = connect(); Statement statement = connection.createStatement()) {
            SqliteSchema.apply(connection, StorageSettings.defaults());
            statement.executeUpdate("INSERT INTO sessions (key, created_at, updated_at) VALUES ('k', 'now', 'now')");
            statement.executeUpdate("INSERT INTO messages (session_key, seq, role, created_at) VALUES ('k', 1, 'user', 'now')");

            assertThat(queryString(connection, "SELECT summary FROM sessions")).isEmpty();
            assertThat(queryString(connection, "SELECT content FROM messages")).isEmpty();
            assertThat(queryString(connection, "SELECT tool_call_id FROM messages")).isEmpty();
            assertThat(queryString(connection, "SELECT tool_calls_json FROM messages")).isNull();
        }
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + tempDir.resolve("schema.db").toAbsolutePath());
    }

    private static int queryInt(Connection connection, String sql) throws SQLException {
        try (Statement statement = connection.createStatement(); ResultSet resultSet = statement.executeQuery(sql)) {
            resultSet.next();
            return resultSet.getInt(1);
        }
    }

    private static String queryString(Connection connection, String sql) throws SQLException {
        try (Statement statement = connection.createStatement(); ResultSet resultSet = statement.executeQuery(sql)) {
            resultSet.next();
            return resultSet.getString(1);
        }
    }
}
