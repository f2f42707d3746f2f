package de.mirkosertic.hgstatus.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe mapping from absolute file path to {@link FileStatusRecord}.
 * <p>
 * This is the single source of truth for status queries. All mutations run under the
 * write lock and are either a merge (records replaced wholesale) or a key removal.
 * {@link #replace(Map)} swaps the whole mapping at once, so readers never observe a
 * partially rebuilt store.
 */
public class StatusStore {

    private static final Logger logger = LoggerFactory.getLogger(StatusStore.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private Map<Path, FileStatusRecord> records = new HashMap<>();

    public Optional<FileStatusRecord> get(final Path path) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(path));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replace the record of every given path with a freshly created one.
     * Size and modification time are read from disk outside the lock.
     */
    public void merge(final Map<Path, Character> statuses) {
        if (statuses.isEmpty()) {
            return;
        }
        final Map<Path, FileStatusRecord> fresh = toRecords(statuses);
        lock.writeLock().lock();
        try {
            records.putAll(fresh);
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Merged {} status entries", fresh.size());
    }

    public void remove(final Path path) {
        lock.writeLock().lock();
        try {
            records.remove(path);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void removeAll(final Collection<Path> paths) {
        lock.writeLock().lock();
        try {
            for (final Path path : paths) {
                records.remove(path);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Atomically swap the store contents for the given mapping. Paths not contained in
     * the new mapping are gone afterwards.
     */
    public void replace(final Map<Path, FileStatusRecord> newRecords) {
        final Map<Path, FileStatusRecord> copy = new HashMap<>(newRecords);
        lock.writeLock().lock();
        try {
            records = copy;
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Replaced status store with {} entries", copy.size());
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            records = new HashMap<>();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Immutable copy of the current contents.
     */
    public Map<Path, FileStatusRecord> snapshot() {
        lock.readLock().lock();
        try {
            return Map.copyOf(records);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Build records for the given statuses without touching the store, used by the full
     * rebuild to assemble a new mapping before swapping it in.
     */
    public static Map<Path, FileStatusRecord> toRecords(final Map<Path, Character> statuses) {
        final Map<Path, FileStatusRecord> result = new HashMap<>();
        for (final Map.Entry<Path, Character> entry : statuses.entrySet()) {
            final Path path = Objects.requireNonNull(entry.getKey(), "path");
            result.put(path, FileStatusRecord.of(path, entry.getValue()));
        }
        return result;
    }
}
