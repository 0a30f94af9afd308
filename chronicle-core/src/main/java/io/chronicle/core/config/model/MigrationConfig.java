package io.chronicle.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.chronicle.core.config.ConfigPaths;
import java.nio.file.Path;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MigrationConfig(String legacyDir, boolean runOnStartup) {

    public static MigrationConfig defaults() {
        return new MigrationConfig("~/.chronicle/workspace/sessions", true);
    }

    public Path resolvedLegacyDir() {
        return ConfigPaths.resolve(legacyDir);
    }
}
