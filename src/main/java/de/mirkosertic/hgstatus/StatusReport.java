package de.mirkosertic.hgstatus;

import de.mirkosertic.hgstatus.status.FileStatus;
import de.mirkosertic.hgstatus.status.FileStatusRecord;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of the cache contents, logged as JSON on every status change.
 */
public record StatusReport(
        /** Number of known repository roots. */
        int roots,
        /** Number of cached files. */
        int files,
        /** Number of cached files per status. */
        Map<FileStatus, Long> counts
) {

    public static StatusReport of(final int roots, final Map<Path, FileStatusRecord> snapshot) {
        final Map<FileStatus, Long> counts = new EnumMap<>(FileStatus.class);
        for (final FileStatusRecord record : snapshot.values()) {
            counts.merge(record.status(), 1L, Long::sum);
        }
        return new StatusReport(roots, snapshot.size(), counts);
    }
}
