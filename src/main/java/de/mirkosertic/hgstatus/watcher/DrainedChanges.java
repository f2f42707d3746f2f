package de.mirkosertic.hgstatus.watcher;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * Changes drained from one change source in a single pass.
 */
public record DrainedChanges(
        /** The watched root the changes belong to. */
        Path root,
        /** Changed path to the time of its latest event. */
        Map<Path, Instant> changes
) {
}
