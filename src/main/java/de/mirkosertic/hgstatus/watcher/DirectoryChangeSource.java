package de.mirkosertic.hgstatus.watcher;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * {@link ChangeSource} backed by a {@link WatchService} registered on the root and all
 * of its subdirectories. Directories created later are registered as they appear.
 */
public class DirectoryChangeSource implements ChangeSource {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryChangeSource.class);

    private final Path root;
    private final long pollIntervalMs;
    private final Clock clock;
    private final Map<WatchKey, Path> watchKeys = new ConcurrentHashMap<>();
    private final Map<Path, Instant> dirtyFiles = new LinkedHashMap<>();
    private final ExecutorService watchExecutor;

    private volatile @Nullable WatchService watchService;
    private volatile @Nullable Instant latestEvent;
    private volatile boolean enabled = true;

    public DirectoryChangeSource(final Path root, final long pollIntervalMs, final Clock clock) {
        this.root = root;
        this.pollIntervalMs = pollIntervalMs;
        this.clock = clock;
        this.watchExecutor = Executors.newSingleThreadExecutor(r -> {
            final Thread thread = new Thread(r, "directory-watcher-" + root.getFileName());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public synchronized void start() throws IOException {
        if (watchService != null) {
            return;
        }
        final WatchService service = FileSystems.getDefault().newWatchService();
        watchService = service;
        registerRecursive(service, root);
        watchExecutor.execute(() -> processEvents(service));
    }

    private void registerRecursive(final WatchService service, final Path directory) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) throws IOException {
                final WatchKey key = dir.register(service, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                watchKeys.put(key, dir);
                logger.trace("Registered watch for directory: {}", dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                logger.debug("Skipping unreadable path while registering watches: {}", file);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void processEvents(final WatchService service) {
        logger.info("Watching repository root: {}", root);

        while (!Thread.currentThread().isInterrupted()) {
            final WatchKey key;
            try {
                key = service.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final ClosedWatchServiceException e) {
                break;
            }

            final Path directory = watchKeys.get(key);
            if (directory == null) {
                logger.warn("Watch key not recognized");
                key.reset();
                continue;
            }

            for (final WatchEvent<?> event : key.pollEvents()) {
                final WatchEvent.Kind<?> kind = event.kind();
                if (kind == OVERFLOW) {
                    logger.warn("Watch event overflow below {}", directory);
                    continue;
                }

                @SuppressWarnings("unchecked") final WatchEvent<Path> pathEvent = (WatchEvent<Path>) event;
                final Path fullPath = directory.resolve(pathEvent.context());

                if (kind == ENTRY_CREATE && Files.isDirectory(fullPath)) {
                    try {
                        registerRecursive(service, fullPath);
                    } catch (final IOException | ClosedWatchServiceException e) {
                        logger.warn("Failed to register watch for new directory: {}", fullPath, e);
                    }
                }
                recordChange(fullPath);
            }

            if (!key.reset()) {
                watchKeys.remove(key);
                logger.debug("Watch key for {} no longer valid", directory);
            }
        }

        logger.info("Stopped watching repository root: {}", root);
    }

    void recordChange(final Path path) {
        if (!enabled) {
            return;
        }
        final Instant now = clock.instant();
        synchronized (dirtyFiles) {
            dirtyFiles.put(path, now);
            latestEvent = now;
        }
    }

    @Override
    public void setEnabled(final boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public Map<Path, Instant> drainDirtyMap() {
        synchronized (dirtyFiles) {
            final Map<Path, Instant> drained = new LinkedHashMap<>(dirtyFiles);
            dirtyFiles.clear();
            return drained;
        }
    }

    @Override
    public Optional<Instant> latestEventTime() {
        return Optional.ofNullable(latestEvent);
    }

    @Override
    public int changedCount() {
        synchronized (dirtyFiles) {
            return dirtyFiles.size();
        }
    }

    @Override
    public void close() {
        watchExecutor.shutdownNow();
        final WatchService service = watchService;
        if (service != null) {
            try {
                service.close();
            } catch (final IOException e) {
                logger.error("Error closing watch service for {}", root, e);
            }
        }
        watchKeys.clear();
        synchronized (dirtyFiles) {
            dirtyFiles.clear();
        }
    }
}
