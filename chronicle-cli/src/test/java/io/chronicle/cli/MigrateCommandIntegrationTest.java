package io.chronicle.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.chronicle.cli.SessionCommandsIntegrationTest.CommandResult;
import io.chronicle.core.config.ConfigService;
import io.chronicle.core.config.model.ChronicleConfig;
import io.chronicle.core.config.model.MigrationConfig;
import io.chronicle.core.config.model.StorageConfig;
import io.chronicle.core.session.OperationContext;
import io.chronicle.core.session.SqliteSessionStore;
import io.chronicle.core.session.StoredMessage;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MigrateCommandIntegrationTest {

    @TempDir
    Path tempDir;

    private Path legacyDir;
    private SqliteSessionStore store;
    private CliContext context;

    @BeforeEach
    void setUp() throws Exception {
        legacyDir = Files.createDirectories(tempDir.resolve("sessions"));
        Path dbPath = tempDir.resolve("memory/sessions.db");
        store = SqliteSessionStore.open(dbPath);
        context = new CliContext(
            store,
            new ConfigService(),
            tempDir.resolve("config.json"),
            new ChronicleConfig(
                new StorageConfig(dbPath.toString(), 5_000, 512),
                new MigrationConfig(legacyDir.toString(), false)
            )
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        store.close();
    }

    @Test
    void shouldMigrateConfiguredDirectoryAndReportSkippedFiles() throws Exception {
        Files.writeString(legacyDir.resolve("discord_7.json"), """
            {"key": "discord:7", "messages": [{"role": "user", "content": "hey"}],
             "created": "2025-01-01T00:00:00Z", "updated": "2025-01-01T00:00:00Z"}
            """);
        Files.writeString(legacyDir.resolve("broken.json"), "not json");

        CommandResult result = SessionCommandsIntegrationTest.run(new MigrateCommand(context));

        assertThat(result.code()).isZero();
        assertThat(result.out()).contains("Imported: 1", "Skipped: broken.json");
        assertThat(store.getHistory(OperationContext.background(), "discord:7"))
            .extracting(StoredMessage::content)
            .containsExactly("hey");
        assertThat(Files.exists(legacyDir.resolve("discord_7.json.migrated"))).isTrue();
    }

    @Test
    void shouldMigrateDirectoryGivenOnCommandLine() throws Exception {
        Path other = Files.createDirectories(tempDir.resolve("other"));
        Files.writeString(other.resolve("x.json"), """
            {"key": "x", "messages": [{"role": "user", "content": "elsewhere"}]}
            """);

        CommandResult first = SessionCommandsIntegrationTest.run(new MigrateCommand(context), "--dir", other.toString());
        CommandResult second = SessionCommandsIntegrationTest.run(new MigrateCommand(context), "--dir", other.toString());

        assertThat(first.out()).contains("Imported: 1");
        assertThat(second.out()).contains("Imported: 0");
        assertThat(store.getHistory(OperationContext.background(), "x")).hasSize(1);
    }
}
