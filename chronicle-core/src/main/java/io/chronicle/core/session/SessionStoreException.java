package io.chronicle.core.session;

import java.io.IOException;

/**
 * A store operation failed and was rolled back. Carries the operation name and, when the operation
 * targets one session, its key.
 */
public class SessionStoreException extends IOException {
    private final String operation;
    private final String sessionKey;

    public SessionStoreException(String operation, String sessionKey, Throwable cause) {
        this(operation, sessionKey, describe(operation, sessionKey), cause);
    }

    public SessionStoreException(String operation, String sessionKey, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.sessionKey = sessionKey;
    }

    public String operation() {
        return operation;
    }

    public String sessionKey() {
        return sessionKey;
    }

    static String describe(String operation, String sessionKey) {
        if (sessionKey == null) {
            return "Failed to " + operation;
        }
        return "Failed to " + operation + " for session '" + sessionKey + "'";
    }
}
