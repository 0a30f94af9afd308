package io.chronicle.core.migration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.chronicle.core.session.OperationCancelledException;
import io.chronicle.core.session.OperationContext;
import io.chronicle.core.session.SessionStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Imports legacy JSON session files into a {@link SessionStore}.
 *
 * <p>Each file is imported in its own transaction and then renamed with a {@value #MIGRATED_SUFFIX}
 * suffix, which keeps the original as a backup and hides it from later runs. A file that cannot be
 * read or parsed is skipped without affecting the rest of the directory.
 */
public final class LegacySessionImporter {
    public static final String LEGACY_SUFFIX = ".json";
    public static final String MIGRATED_SUFFIX = ".migrated";

    private static final Logger LOG = LoggerFactory.getLogger(LegacySessionImporter.class);

    private final SessionStore store;
    private final ObjectMapper mapper;

    public LegacySessionImporter(SessionStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    /**
     * Imports every pending session file in {@code legacyDir}. A missing directory yields an empty
     * report.
     *
     * @throws IOException if the directory exists but cannot be listed, or the context is cancelled
     */
    public MigrationReport migrate(OperationContext context, Path legacyDir) throws IOException {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(legacyDir, "legacyDir must not be null");
        if (!Files.exists(legacyDir)) {
            LOG.debug("Legacy session directory {} does not exist, nothing to migrate", legacyDir);
            return MigrationReport.empty();
        }

        List<Path> candidates;
        try (Stream<Path> entries = Files.list(legacyDir)) {
            candidates = entries.filter(LegacySessionImporter::isCandidate).sorted().toList();
        }

        List<String> imported = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> renameFailed = new ArrayList<>();
        for (Path file : candidates) {
            String name = file.getFileName().toString();
            LegacySession session = read(file);
            if (session == null) {
                skipped.add(name);
                continue;
            }
            if (!importSession(context, file, session)) {
                skipped.add(name);
                continue;
            }
            if (markMigrated(file)) {
                imported.add(name);
            } else {
                renameFailed.add(name);
            }
        }

        MigrationReport report = new MigrationReport(imported, skipped, renameFailed);
        if (!candidates.isEmpty()) {
            LOG.info(
                "Migrated {} legacy session file(s) from {} ({} skipped, {} not renamed)",
                report.importedCount(),
                legacyDir,
                skipped.size(),
                renameFailed.size()
            );
        }
        return report;
    }

    static boolean isCandidate(Path path) {
        String name = path.getFileName().toString();
        return Files.isRegularFile(path) && name.endsWith(LEGACY_SUFFIX) && !name.endsWith(MIGRATED_SUFFIX);
    }

    private LegacySession read(Path file) {
        LegacySession session;
        try {
            session = mapper.readValue(Files.readString(file, StandardCharsets.UTF_8), LegacySession.class);
        } catch (IOException e) {
            LOG.warn("Skipping legacy session file {}: {}", file, e.getMessage());
            return null;
        }
        if (session == null || session.key() == null || session.key().isBlank()) {
            LOG.warn("Skipping legacy session file {}: missing session key", file);
            return null;
        }
        return session;
    }

    private boolean importSession(OperationContext context, Path file, LegacySession session) throws IOException {
        try {
            boolean written = store.importSession(context, session.toSnapshot());
            if (!written) {
                LOG.debug("Session '{}' from {} already has messages, leaving them untouched", session.key(), file);
            }
            return true;
        } catch (OperationCancelledException e) {
            throw e;
        } catch (IOException e) {
            LOG.warn("Skipping legacy session file {}: {}", file, e.getMessage());
            return false;
        }
    }

    private boolean markMigrated(Path file) {
        Path target = file.resolveSibling(file.getFileName() + MIGRATED_SUFFIX);
        try {
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (IOException e) {
            LOG.warn("Imported {} but could not rename it to {}; it will be retried on the next run", file, target, e);
            return false;
        }
    }
}
