package io.chronicle.cli;

import io.chronicle.core.config.ConfigService;
import io.chronicle.core.config.model.ChronicleConfig;
import io.chronicle.core.migration.LegacySessionImporter;
import io.chronicle.core.session.SessionStore;
import java.nio.file.Path;

public record CliContext(
    SessionStore store,
    LegacySessionImporter importer,
    ConfigService configService,
    Path configPath,
    ChronicleConfig config
) {
    public CliContext(SessionStore store, ConfigService configService, Path configPath, ChronicleConfig config) {
        this(store, new LegacySessionImporter(store), configService, configPath, config);
    }
}
