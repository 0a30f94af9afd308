package io.chronicle.core.session;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Connection tuning and table creation for the session database. Every statement is safe to run
 * against an existing database.
 */
public final class SqliteSchema {

    static final String SESSIONS_DDL = """
        CREATE TABLE IF NOT EXISTS sessions (
            key        TEXT PRIMARY KEY,
            summary    TEXT NOT NULL DEFAULT '',
            created_at TEXT NOT NULL,
            updated_at TEXT NOT NULL
        )
        """;

    static final String MESSAGES_DDL = """
        CREATE TABLE IF NOT EXISTS messages (
            id              INTEGER PRIMARY KEY AUTOINCREMENT,
            session_key     TEXT    NOT NULL REFERENCES sessions(key) ON DELETE CASCADE,
            seq             INTEGER NOT NULL,
            role            TEXT    NOT NULL,
            content         TEXT    NOT NULL DEFAULT '',
            tool_calls_json TEXT,
            tool_call_id    TEXT    NOT NULL DEFAULT '',
            created_at      TEXT    NOT NULL,
            UNIQUE(session_key, seq)
        )
        """;

    private SqliteSchema() {
    }

    public static void apply(Connection connection, StorageSettings settings) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String pragma : pragmas(settings)) {
                try {
                    statement.execute(pragma);
                } catch (SQLException e) {
                    throw new SQLException("Failed to apply " + pragma, e);
                }
            }
            statement.execute(SESSIONS_DDL);
            statement.execute(MESSAGES_DDL);
        }
    }

    static List<String> pragmas(StorageSettings settings) {
        return List.of(
            "PRAGMA journal_mode=WAL",
            "PRAGMA busy_timeout=" + settings.busyTimeoutMillis(),
            "PRAGMA synchronous=NORMAL",
            "PRAGMA foreign_keys=ON",
            "PRAGMA cache_size=-" + settings.cacheSizeKib()
        );
    }
}
