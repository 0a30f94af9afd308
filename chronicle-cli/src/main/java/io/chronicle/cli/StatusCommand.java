package io.chronicle.cli;

import io.chronicle.core.config.model.ChronicleConfig;
import io.chronicle.core.session.OperationContext;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show storage and configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ChronicleConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database: " + config.storage().resolvedDatabasePath());
            System.out.println("Legacy directory: " + config.migration().resolvedLegacyDir());
            System.out.println("Migrate on startup: " + config.migration().runOnStartup());
            System.out.println("Sessions: " + context.store().listSessions(OperationContext.background()).size());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
