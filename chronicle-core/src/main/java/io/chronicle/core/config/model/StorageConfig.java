package io.chronicle.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.chronicle.core.config.ConfigPaths;
import io.chronicle.core.session.StorageSettings;
import java.nio.file.Path;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(String databasePath, int busyTimeoutMillis, int cacheSizeKib) {

    public static StorageConfig defaults() {
        StorageSettings settings = StorageSettings.defaults();
        return new StorageConfig(
            "~/.chronicle/workspace/memory/sessions.db",
            settings.busyTimeoutMillis(),
            settings.cacheSizeKib()
        );
    }

    public Path resolvedDatabasePath() {
        return ConfigPaths.resolve(databasePath);
    }

    public StorageSettings settings() {
        return new StorageSettings(busyTimeoutMillis, cacheSizeKib);
    }
}
