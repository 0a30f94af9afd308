package io.chronicle.cli;

import io.chronicle.core.migration.MigrationReport;
import io.chronicle.core.session.OperationContext;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "migrate", description = "Import legacy JSON session files into the session store")
public final class MigrateCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-d", "--dir"}, description = "Legacy session directory (defaults to migration.legacyDir)")
    Path dir;

    public MigrateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Path legacyDir = dir != null ? dir : context.config().migration().resolvedLegacyDir();
        try {
            MigrationReport report = context.importer().migrate(OperationContext.background(), legacyDir);
            System.out.println("Legacy directory: " + legacyDir);
            System.out.println("Imported: " + report.importedCount());
            if (!report.skipped().isEmpty()) {
                System.out.println("Skipped: " + String.join(", ", report.skipped()));
            }
            if (!report.renameFailed().isEmpty()) {
                System.out.println("Imported but not renamed: " + String.join(", ", report.renameFailed()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Migrate command failed: " + e.getMessage());
            return 1;
        }
    }
}
