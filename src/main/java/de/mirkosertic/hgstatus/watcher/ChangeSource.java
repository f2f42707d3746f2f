package de.mirkosertic.hgstatus.watcher;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Source of raw changed-path notifications for one watched root.
 * <p>
 * Changes accumulate in a dirty map (path to last event time) until they are drained.
 * Repeated events for the same path between two drains collapse into one entry.
 */
public interface ChangeSource extends AutoCloseable {

    Path root();

    void start() throws IOException;

    /**
     * Pause or resume recording of change events.
     */
    void setEnabled(boolean enabled);

    /**
     * Atomically return all changes recorded since the last drain and reset the dirty map.
     */
    Map<Path, Instant> drainDirtyMap();

    /**
     * Time of the most recent change event, empty if the source never fired.
     */
    Optional<Instant> latestEventTime();

    int changedCount();

    @Override
    void close();
}
