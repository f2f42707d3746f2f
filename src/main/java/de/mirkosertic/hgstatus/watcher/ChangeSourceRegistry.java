package de.mirkosertic.hgstatus.watcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns one {@link ChangeSource} per watched root and aggregates their state.
 * <p>
 * Sources are kept in registration order, which is also the order of {@link #drainAll()}.
 */
public class ChangeSourceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ChangeSourceRegistry.class);

    /** Reported as latest change age when no source ever fired. */
    static final Duration NO_CHANGE_AGE = Duration.ofDays(1);

    private final ChangeSourceFactory factory;
    private final Clock clock;
    private final Map<Path, ChangeSource> sources = new LinkedHashMap<>();

    private volatile boolean enabled = true;

    public ChangeSourceRegistry(final ChangeSourceFactory factory, final Clock clock) {
        this.factory = factory;
        this.clock = clock;
    }

    /**
     * Start watching the given root unless a source for exactly this directory exists.
     *
     * @return true if the root is watched after the call
     */
    public synchronized boolean watch(final Path root) {
        if (sources.containsKey(root)) {
            return true;
        }
        final ChangeSource source = factory.create(root);
        try {
            source.start();
        } catch (final IOException e) {
            logger.error("Failed to setup watcher for root: {}", root, e);
            source.close();
            return false;
        }
        source.setEnabled(enabled);
        sources.put(root, source);
        logger.info("Watching root: {}", root);
        return true;
    }

    public synchronized boolean isWatching(final Path root) {
        return sources.containsKey(root);
    }

    /**
     * Pause or resume event recording on all sources, including sources added later.
     */
    public synchronized void setEnabled(final boolean enabled) {
        this.enabled = enabled;
        for (final ChangeSource source : sources.values()) {
            source.setEnabled(enabled);
        }
        logger.debug("Change recording {}", enabled ? "enabled" : "disabled");
    }

    public synchronized int changedFileCount() {
        int count = 0;
        for (final ChangeSource source : sources.values()) {
            count += source.changedCount();
        }
        return count;
    }

    /**
     * The most recent event time over all sources. If no source ever fired this is a
     * point far in the past, so elapsed-time checks see plenty of quiet time.
     */
    public synchronized Instant latestChangeTime() {
        Instant latest = null;
        for (final ChangeSource source : sources.values()) {
            final Optional<Instant> eventTime = source.latestEventTime();
            if (eventTime.isPresent() && (latest == null || eventTime.get().isAfter(latest))) {
                latest = eventTime.get();
            }
        }
        return latest != null ? latest : clock.instant().minus(NO_CHANGE_AGE);
    }

    public synchronized List<DrainedChanges> drainAll() {
        final List<DrainedChanges> result = new ArrayList<>(sources.size());
        for (final ChangeSource source : sources.values()) {
            result.add(new DrainedChanges(source.root(), source.drainDirtyMap()));
        }
        return result;
    }

    public synchronized int size() {
        return sources.size();
    }

    /**
     * Stop and discard all sources.
     */
    public synchronized void unsubscribeAll() {
        for (final ChangeSource source : sources.values()) {
            try {
                source.close();
            } catch (final RuntimeException e) {
                logger.error("Error stopping watcher for root: {}", source.root(), e);
            }
        }
        sources.clear();
    }

    public void clear() {
        unsubscribeAll();
    }
}
