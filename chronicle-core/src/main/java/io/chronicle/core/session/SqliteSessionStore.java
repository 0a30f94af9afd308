package io.chronicle.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.chronicle.core.model.ChatMessage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionStore} backed by a single SQLite connection.
 *
 * <p>All public methods synchronize on the store, so callers queue on the one connection and the
 * read-max-seq-then-insert sequence of an append cannot interleave with another append.
 */
public final class SqliteSessionStore implements SessionStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteSessionStore.class);

    private static final String INSERT_MESSAGE = """
        INSERT INTO messages (session_key, seq, role, content, tool_calls_json, tool_call_id, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        """;

    private final Path dbPath;
    private final Clock clock;
    private final ObjectMapper mapper;
    private Connection connection;

    private SqliteSessionStore(Path dbPath, Connection connection, Clock clock) {
        this.dbPath = dbPath;
        this.connection = connection;
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    public static SqliteSessionStore open(Path dbPath) throws SessionStoreException {
        return open(dbPath, StorageSettings.defaults(), Clock.systemUTC());
    }

    public static SqliteSessionStore open(Path dbPath, StorageSettings settings, Clock clock) throws SessionStoreException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        Path absolute = dbPath.toAbsolutePath();
        try {
            Files.createDirectories(absolute.getParent());
        } catch (IOException e) {
            throw new SessionStoreException("open", null, "Failed to create database directory " + absolute.getParent(), e);
        }

        Connection connection;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + absolute);
        } catch (SQLException e) {
            throw new SessionStoreException("open", null, "Failed to connect to SQLite database " + absolute, e);
        }

        try {
            SqliteSchema.apply(connection, settings);
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new SessionStoreException("open", null, "Failed to initialize SQLite session store at " + absolute, e);
        }
        LOG.debug("Opened session store at {}", absolute);
        return new SqliteSessionStore(absolute, connection, clock);
    }

    @Override
    public void addMessage(OperationContext context, String sessionKey, String role, String content) throws IOException {
        addFullMessage(context, sessionKey, ChatMessage.of(role, content));
    }

    @Override
    public synchronized void addFullMessage(OperationContext context, String sessionKey, ChatMessage message) throws IOException {
        Objects.requireNonNull(sessionKey, "sessionKey must not be null");
        Objects.requireNonNull(message, "message must not be null");
        inTransaction(context, "add message", sessionKey, conn -> {
            String now = timestamp();
            ensureSession(conn, context, sessionKey, "", now, now);
            int seq = nextSeq(conn, context, sessionKey);
            ToolCallsJson toolCalls = ToolCallsJson.encode(mapper, message.toolCalls());
            insertMessage(conn, context, sessionKey, seq, message, toolCalls, now);
            touchSession(conn, context, sessionKey, now);
            return null;
        });
    }

    @Override
    public synchronized List<StoredMessage> getHistory(OperationContext context, String sessionKey) throws IOException {
        Objects.requireNonNull(sessionKey, "sessionKey must not be null");
        String sql = """
            SELECT seq, role, content, tool_calls_json, tool_call_id, created_at
            FROM messages
            WHERE session_key = ?
            ORDER BY seq ASC
            """;
        return read(context, "get history", sessionKey, conn -> {
            try (PreparedStatement statement = prepare(conn, context, sql)) {
                statement.setString(1, sessionKey);
                List<StoredMessage> history = new ArrayList<>();
                try (ResultSet resultSet = executeQuery(context, statement)) {
                    while (resultSet.next()) {
                        ToolCallsJson toolCalls = ToolCallsJson.fromColumn(resultSet.getString("tool_calls_json"));
                        ChatMessage message = new ChatMessage(
                            resultSet.getString("role"),
                            resultSet.getString("content"),
                            resultSet.getString("tool_call_id"),
                            toolCalls.decode(mapper)
                        );
                        history.add(new StoredMessage(
                            resultSet.getInt("seq"),
                            message,
                            Instant.parse(resultSet.getString("created_at"))
                        ));
                    }
                }
                return history;
            }
        });
    }

    @Override
    public synchronized String getSummary(OperationContext context, String sessionKey) throws IOException {
        Objects.requireNonNull(sessionKey, "sessionKey must not be null");
        return read(context, "get summary", sessionKey, conn -> {
            try (PreparedStatement statement = prepare(conn, context, "SELECT summary FROM sessions WHERE key = ?")) {
                statement.setString(1, sessionKey);
                try (ResultSet resultSet = executeQuery(context, statement)) {
                    return resultSet.next() ? resultSet.getString("summary") : "";
                }
            }
        });
    }

    @Override
    public synchronized void setSummary(OperationContext context, String sessionKey, String summary) throws IOException {
        Objects.requireNonNull(sessionKey, "sessionKey must not be null");
        inTransaction(context, "set summary", sessionKey, conn -> {
            String now = timestamp();
            ensureSession(conn, context, sessionKey, "", now, now);
            try (PreparedStatement statement = prepare(conn, context,
                "UPDATE sessions SET summary = ?, updated_at = ? WHERE key = ?")) {
                statement.setString(1, summary == null ? "" : summary);
                statement.setString(2, now);
                statement.setString(3, sessionKey);
                executeUpdate(context, statement);
            }
            return null;
        });
    }

    @Override
    public synchronized void truncateHistory(OperationContext context, String sessionKey, int keepLast) throws IOException {
        Objects.requireNonNull(sessionKey, "sessionKey must not be null");
        inTransaction(context, "truncate history", sessionKey, conn -> {
            if (keepLast <= 0) {
                deleteMessages(conn, context, sessionKey);
            } else {
                String sql = """
                    DELETE FROM messages
                    WHERE session_key = ? AND id NOT IN (
                        SELECT id FROM messages WHERE session_key = ? ORDER BY seq DESC LIMIT ?
                    )
                    """;
                try (PreparedStatement statement = prepare(conn, context, sql)) {
                    statement.setString(1, sessionKey);
                    statement.setString(2, sessionKey);
                    statement.setInt(3, keepLast);
                    executeUpdate(context, statement);
                }
            }
            touchSession(conn, context, sessionKey, timestamp());
            return null;
        });
    }

    @Override
    public synchronized void setHistory(OperationContext context, String sessionKey, List<ChatMessage> messages) throws IOException {
        Objects.requireNonNull(sessionKey, "sessionKey must not be null");
        List<ChatMessage> replacement = messages == null ? List.of() : List.copyOf(messages);
        inTransaction(context, "set history", sessionKey, conn -> {
            String now = timestamp();
            ensureSession(conn, context, sessionKey, "", now, now);
            deleteMessages(conn, context, sessionKey);
            insertAll(conn, context, sessionKey, replacement, now);
            touchSession(conn, context, sessionKey, now);
            return null;
        });
    }

    @Override
    public synchronized List<SessionInfo> listSessions(OperationContext context) throws IOException {
        String sql = """
            SELECT s.key, s.summary, s.created_at, s.updated_at, COUNT(m.id) AS message_count
            FROM sessions s
            LEFT JOIN messages m ON m.session_key = s.key
            GROUP BY s.key, s.summary, s.created_at, s.updated_at
            ORDER BY s.updated_at DESC, s.key ASC
            """;
        return read(context, "list sessions", null, conn -> {
            try (PreparedStatement statement = prepare(conn, context, sql);
                 ResultSet resultSet = executeQuery(context, statement)) {
                List<SessionInfo> sessions = new ArrayList<>();
                while (resultSet.next()) {
                    sessions.add(new SessionInfo(
                        resultSet.getString("key"),
                        resultSet.getString("summary"),
                        resultSet.getInt("message_count"),
                        Instant.parse(resultSet.getString("created_at")),
                        Instant.parse(resultSet.getString("updated_at"))
                    ));
                }
                return sessions;
            }
        });
    }

    @Override
    public synchronized boolean importSession(OperationContext context, SessionSnapshot snapshot) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        String sessionKey = snapshot.key();
        return inTransaction(context, "import session", sessionKey, conn -> {
            String now = timestamp();
            String createdAt = snapshot.createdAt() == null ? now : timestamp(snapshot.createdAt());
            String updatedAt = snapshot.updatedAt() == null ? now : timestamp(snapshot.updatedAt());
            ensureSession(conn, context, sessionKey, snapshot.summary(), createdAt, updatedAt);
            if (countMessages(conn, context, sessionKey) > 0) {
                return false;
            }
            insertAll(conn, context, sessionKey, snapshot.messages(), now);
            return true;
        });
    }

    /**
     * Releases the connection. Later operations fail with {@link SessionStoreException}.
     */
    @Override
    public synchronized void close() throws SessionStoreException {
        if (connection == null) {
            return;
        }
        Connection closing = connection;
        connection = null;
        try {
            closing.close();
            LOG.debug("Closed session store at {}", dbPath);
        } catch (SQLException e) {
            throw new SessionStoreException("close", null, "Failed to close session store at " + dbPath, e);
        }
    }

    private <T> T inTransaction(OperationContext context, String operation, String sessionKey, SqlWork<T> work)
        throws SessionStoreException {
        Objects.requireNonNull(context, "context must not be null");
        Connection conn = requireOpen(operation, sessionKey);
        try {
            context.checkActive();
            conn.setAutoCommit(false);
            T result = work.execute(conn);
            context.checkActive();
            conn.commit();
            return result;
        } catch (SQLException | IOException | CancellationException e) {
            rollback(conn, e);
            throw translate(context, operation, sessionKey, e);
        } catch (RuntimeException e) {
            rollback(conn, e);
            throw e;
        } finally {
            restoreAutoCommit(conn);
        }
    }

    private <T> T read(OperationContext context, String operation, String sessionKey, SqlWork<T> work)
        throws SessionStoreException {
        Objects.requireNonNull(context, "context must not be null");
        Connection conn = requireOpen(operation, sessionKey);
        try {
            return work.execute(conn);
        } catch (SQLException | IOException | CancellationException e) {
            throw translate(context, operation, sessionKey, e);
        }
    }

    private Connection requireOpen(String operation, String sessionKey) throws SessionStoreException {
        if (connection == null) {
            throw new SessionStoreException(
                operation,
                sessionKey,
                SessionStoreException.describe(operation, sessionKey) + ": session store is closed",
                null
            );
        }
        return connection;
    }

    private SessionStoreException translate(OperationContext context, String operation, String sessionKey, Exception e) {
        if (e instanceof CancellationException || context.isCancelled()) {
            return new OperationCancelledException(operation, sessionKey, e);
        }
        return new SessionStoreException(operation, sessionKey, e);
    }

    private void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private void restoreAutoCommit(Connection conn) {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            LOG.warn("Failed to restore auto-commit on session store connection", e);
        }
    }

    private void ensureSession(
        Connection conn,
        OperationContext context,
        String sessionKey,
        String summary,
        String createdAt,
        String updatedAt
    ) throws SQLException {
        try (PreparedStatement exists = prepare(conn, context, "SELECT 1 FROM sessions WHERE key = ?")) {
            exists.setString(1, sessionKey);
            try (ResultSet resultSet = executeQuery(context, exists)) {
                if (resultSet.next()) {
                    return;
                }
            }
        }
        try (PreparedStatement insert = prepare(conn, context,
            "INSERT INTO sessions (key, summary, created_at, updated_at) VALUES (?, ?, ?, ?)")) {
            insert.setString(1, sessionKey);
            insert.setString(2, summary);
            insert.setString(3, createdAt);
            insert.setString(4, updatedAt);
            executeUpdate(context, insert);
        }
    }

    private void touchSession(Connection conn, OperationContext context, String sessionKey, String now) throws SQLException {
        try (PreparedStatement statement = prepare(conn, context, "UPDATE sessions SET updated_at = ? WHERE key = ?")) {
            statement.setString(1, now);
            statement.setString(2, sessionKey);
            executeUpdate(context, statement);
        }
    }

    private int nextSeq(Connection conn, OperationContext context, String sessionKey) throws SQLException {
        try (PreparedStatement statement = prepare(conn, context, "SELECT MAX(seq) FROM messages WHERE session_key = ?")) {
            statement.setString(1, sessionKey);
            try (ResultSet resultSet = executeQuery(context, statement)) {
                if (!resultSet.next()) {
                    return 1;
                }
                int max = resultSet.getInt(1);
                return resultSet.wasNull() ? 1 : max + 1;
            }
        }
    }

    private int countMessages(Connection conn, OperationContext context, String sessionKey) throws SQLException {
        try (PreparedStatement statement = prepare(conn, context, "SELECT COUNT(*) FROM messages WHERE session_key = ?")) {
            statement.setString(1, sessionKey);
            try (ResultSet resultSet = executeQuery(context, statement)) {
                return resultSet.next() ? resultSet.getInt(1) : 0;
            }
        }
    }

    private void deleteMessages(Connection conn, OperationContext context, String sessionKey) throws SQLException {
        try (PreparedStatement statement = prepare(conn, context, "DELETE FROM messages WHERE session_key = ?")) {
            statement.setString(1, sessionKey);
            executeUpdate(context, statement);
        }
    }

    private void insertAll(
        Connection conn,
        OperationContext context,
        String sessionKey,
        List<ChatMessage> messages,
        String now
    ) throws SQLException, IOException {
        int seq = 1;
        for (ChatMessage message : messages) {
            ToolCallsJson toolCalls = ToolCallsJson.encode(mapper, message.toolCalls());
            insertMessage(conn, context, sessionKey, seq, message, toolCalls, now);
            seq++;
        }
    }

    private void insertMessage(
        Connection conn,
        OperationContext context,
        String sessionKey,
        int seq,
        ChatMessage message,
        ToolCallsJson toolCalls,
        String now
    ) throws SQLException {
        try (PreparedStatement statement = prepare(conn, context, INSERT_MESSAGE)) {
            statement.setString(1, sessionKey);
            statement.setInt(2, seq);
            statement.setString(3, message.role());
            statement.setString(4, message.content());
            toolCalls.bind(statement, 5);
            statement.setString(6, message.toolCallId());
            statement.setString(7, now);
            executeUpdate(context, statement);
        }
    }

    private PreparedStatement prepare(Connection conn, OperationContext context, String sql) throws SQLException {
        context.checkActive();
        return conn.prepareStatement(sql);
    }

    private int executeUpdate(OperationContext context, PreparedStatement statement) throws SQLException {
        context.attach(statement);
        try {
            return statement.executeUpdate();
        } finally {
            context.detach(statement);
        }
    }

    // The result set is consumed after detach; SQLite steps rows lazily, so a cancel arriving
    // mid-iteration is caught by the next checkActive instead of interrupting the read.
    private ResultSet executeQuery(OperationContext context, PreparedStatement statement) throws SQLException {
        context.attach(statement);
        try {
            return statement.executeQuery();
        } finally {
            context.detach(statement);
        }
    }

    private String timestamp() {
        return timestamp(clock.instant());
    }

    private static String timestamp(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T execute(Connection connection) throws SQLException, IOException;
    }
}
