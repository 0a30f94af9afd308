package io.chronicle.app;

import io.chronicle.cli.ChronicleCliCommand;
import io.chronicle.cli.CliContext;
import io.chronicle.cli.HistoryCommand;
import io.chronicle.cli.MigrateCommand;
import io.chronicle.cli.SessionsCommand;
import io.chronicle.cli.StatusCommand;
import io.chronicle.cli.SummaryCommand;
import io.chronicle.cli.TruncateCommand;
import io.chronicle.core.config.ConfigPaths;
import io.chronicle.core.config.ConfigService;
import io.chronicle.core.config.model.ChronicleConfig;
import io.chronicle.core.migration.LegacySessionImporter;
import io.chronicle.core.session.OperationContext;
import io.chronicle.core.session.SessionStoreException;
import io.chronicle.core.session.SqliteSessionStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class ChronicleApplication {
    private static final Logger LOG = LoggerFactory.getLogger(ChronicleApplication.class);

    private ChronicleApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        ChronicleConfig config = loadConfig(configService, configPath);

        SqliteSessionStore store;
        try {
            store = SqliteSessionStore.open(
                config.storage().resolvedDatabasePath(),
                config.storage().settings(),
                Clock.systemUTC()
            );
        } catch (SessionStoreException e) {
            LOG.error("Cannot open session store", e);
            System.err.println("Failed to open session store: " + e.getMessage());
            System.exit(1);
            return;
        }

        int exitCode;
        try {
            LegacySessionImporter importer = new LegacySessionImporter(store);
            if (config.migration().runOnStartup()) {
                migrateOnStartup(importer, config.migration().resolvedLegacyDir());
            }

            CliContext context = new CliContext(store, importer, configService, configPath, config);
            CommandLine commandLine = new CommandLine(new ChronicleCliCommand());
            commandLine.addSubcommand("migrate", new MigrateCommand(context));
            commandLine.addSubcommand("sessions", new SessionsCommand(context));
            commandLine.addSubcommand("history", new HistoryCommand(context));
            commandLine.addSubcommand("summary", new SummaryCommand(context));
            commandLine.addSubcommand("truncate", new TruncateCommand(context));
            commandLine.addSubcommand("status", new StatusCommand(context));
            exitCode = commandLine.execute(args);
        } finally {
            closeStore(store);
        }
        System.exit(exitCode);
    }

    private static ChronicleConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Failed to load config from {}, using defaults: {}", configPath, e.getMessage());
            return ChronicleConfig.defaults();
        }
    }

    private static void migrateOnStartup(LegacySessionImporter importer, Path legacyDir) {
        try {
            importer.migrate(OperationContext.background(), legacyDir);
        } catch (IOException e) {
            LOG.warn("Startup migration from {} failed: {}", legacyDir, e.getMessage());
        }
    }

    private static void closeStore(SqliteSessionStore store) {
        try {
            store.close();
        } catch (SessionStoreException e) {
            LOG.warn("Failed to close session store", e);
        }
    }
}
