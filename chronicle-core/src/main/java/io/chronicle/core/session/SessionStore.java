package io.chronicle.core.session;

import io.chronicle.core.model.ChatMessage;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Persistent per-session message history plus a rolling summary.
 *
 * <p>Sessions are addressed by an opaque caller-assigned key and are created implicitly on the
 * first message or summary write. Every mutating call is atomic: it either applies completely or
 * leaves the store untouched and throws.
 */
public interface SessionStore extends Closeable {

    /**
     * Appends a plain text message with no tool-call data.
     */
    void addMessage(OperationContext context, String sessionKey, String role, String content) throws IOException;

    /**
     * Appends a message, assigning it the next sequence number of the session.
     */
    void addFullMessage(OperationContext context, String sessionKey, ChatMessage message) throws IOException;

    /**
     * Returns the session history ordered by ascending sequence number, or an empty list when the
     * session has no messages or does not exist.
     */
    List<StoredMessage> getHistory(OperationContext context, String sessionKey) throws IOException;

    /**
     * Returns the session summary, or an empty string when the session does not exist.
     */
    String getSummary(OperationContext context, String sessionKey) throws IOException;

    void setSummary(OperationContext context, String sessionKey, String summary) throws IOException;

    /**
     * Keeps only the {@code keepLast} most recent messages. A non-positive value clears the history.
     */
    void truncateHistory(OperationContext context, String sessionKey, int keepLast) throws IOException;

    /**
     * Replaces the whole history, renumbering messages from 1 in the given order.
     */
    void setHistory(OperationContext context, String sessionKey, List<ChatMessage> messages) throws IOException;

    List<SessionInfo> listSessions(OperationContext context) throws IOException;

    /**
     * Seeds a session from an external snapshot. The session row is only inserted when absent and
     * messages are only written when the session has none yet, so repeating the call is harmless.
     *
     * @return {@code true} if the snapshot's messages were written
     */
    boolean importSession(OperationContext context, SessionSnapshot snapshot) throws IOException;
}
