package io.chronicle.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.chronicle.core.config.model.ChronicleConfig;
import io.chronicle.core.config.model.MigrationConfig;
import io.chronicle.core.config.model.StorageConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        ChronicleConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.storage().databasePath()).isEqualTo("~/.chronicle/workspace/memory/sessions.db");
        assertThat(config.storage().busyTimeoutMillis()).isEqualTo(5_000);
        assertThat(config.storage().cacheSizeKib()).isEqualTo(512);
        assertThat(config.migration().runOnStartup()).isTrue();
    }

    @Test
    void shouldMergeDefaultsWithExistingValues() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "storage": {
                "databasePath": "/var/lib/chronicle/sessions.db"
              },
              "migration": {
                "runOnStartup": false
              },
              "unknown": {"ignored": true}
            }
            """);

        ChronicleConfig config = service.load(configPath);

        assertThat(config.storage().resolvedDatabasePath()).isEqualTo(Path.of("/var/lib/chronicle/sessions.db"));
        assertThat(config.storage().busyTimeoutMillis()).isEqualTo(5_000);
        assertThat(config.migration().runOnStartup()).isFalse();
        assertThat(config.migration().legacyDir()).isEqualTo("~/.chronicle/workspace/sessions");
    }

    @Test
    void shouldRoundTripSavedConfig() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("nested/config.json");
        ChronicleConfig config = new ChronicleConfig(
            new StorageConfig(tempDir.resolve("db/sessions.db").toString(), 1_000, 128),
            new MigrationConfig(tempDir.resolve("legacy").toString(), false)
        );

        service.save(configPath, config);

        assertThat(service.load(configPath)).isEqualTo(config);
        assertThat(service.toPrettyJson(config)).contains("\"busyTimeoutMillis\" : 1000");
    }

    @Test
    void shouldExpandHomeDirectory() {
        Path home = Path.of(System.getProperty("user.home"));

        assertThat(ConfigPaths.resolve("~/.chronicle/sessions")).isEqualTo(home.resolve(".chronicle/sessions"));
        assertThat(ConfigPaths.resolve("~")).isEqualTo(home);
        assertThat(ConfigPaths.resolve("relative/path")).isEqualTo(Path.of("relative/path"));
    }
}
