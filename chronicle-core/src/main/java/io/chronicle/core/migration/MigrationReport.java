package io.chronicle.core.migration;

import java.util.List;

/**
 * Outcome of one importer run.
 *
 * @param imported files committed and renamed
 * @param skipped files left untouched because they could not be read, parsed or stored
 * @param renameFailed files committed but not renamed; they are picked up again on the next run
 */
public record MigrationReport(List<String> imported, List<String> skipped, List<String> renameFailed) {

    public MigrationReport {
        imported = List.copyOf(imported);
        skipped = List.copyOf(skipped);
        renameFailed = List.copyOf(renameFailed);
    }

    public static MigrationReport empty() {
        return new MigrationReport(List.of(), List.of(), List.of());
    }

    public int importedCount() {
        return imported.size();
    }
}
