package io.chronicle.core.session;

/**
 * SQLite tuning applied when a store is opened.
 *
 * @param busyTimeoutMillis how long a statement waits on a locked database before failing
 * @param cacheSizeKib page cache budget in KiB
 */
public record StorageSettings(int busyTimeoutMillis, int cacheSizeKib) {

    public StorageSettings {
        if (busyTimeoutMillis < 0) {
            throw new IllegalArgumentException("busyTimeoutMillis must not be negative");
        }
        if (cacheSizeKib <= 0) {
            throw new IllegalArgumentException("cacheSizeKib must be positive");
        }
    }

    public static StorageSettings defaults() {
        return new StorageSettings(5_000, 512);
    }
}
