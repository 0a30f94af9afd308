package io.chronicle.core.session;

public final class OperationCancelledException extends SessionStoreException {

    public OperationCancelledException(String operation, String sessionKey, Throwable cause) {
        super(operation, sessionKey, describe(operation, sessionKey) + ": " + reason(cause), cause);
    }

    private static String reason(Throwable cause) {
        return cause == null || cause.getMessage() == null ? "operation cancelled" : cause.getMessage();
    }
}
