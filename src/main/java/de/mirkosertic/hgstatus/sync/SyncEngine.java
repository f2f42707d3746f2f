package de.mirkosertic.hgstatus.sync;

import de.mirkosertic.hgstatus.config.ApplicationConfig;
import de.mirkosertic.hgstatus.hg.VersionControlClient;
import de.mirkosertic.hgstatus.status.FileStatusRecord;
import de.mirkosertic.hgstatus.status.StatusStore;
import de.mirkosertic.hgstatus.watcher.ChangeSourceRegistry;
import de.mirkosertic.hgstatus.watcher.DrainedChanges;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the {@link StatusStore} in sync with the repository.
 * <p>
 * A one-shot timer fires every tick interval and is re-armed when the tick is done, so
 * ticks never overlap. Each tick either does nothing, requeries the dirty paths drained
 * from the change sources, or rebuilds the whole cache:
 * <ul>
 *   <li>a rebuild runs when one was requested or more than the change threshold paths
 *       are pending, once no change arrived for the rebuild quiet period;</li>
 *   <li>otherwise pending paths are refreshed once no change arrived for the shorter
 *       incremental quiet period.</li>
 * </ul>
 * Operations that write repository metadata stamp the self-modification time first, so
 * the resulting change of the repository state file does not trigger a rebuild.
 */
public class SyncEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SyncEngine.class);

    private final StatusStore store;
    private final ChangeSourceRegistry registry;
    private final RootManager rootManager;
    private final VersionControlClient client;
    private final StatusUpdateChannel channel;
    private final Clock clock;
    private final SyncFlags flags;
    private final ChangeClassifier classifier;

    private final long tickIntervalMs;
    private final int rebuildChangeThreshold;
    private final long rebuildQuietPeriodMs;
    private final long incrementalQuietPeriodMs;

    private final ScheduledExecutorService tickScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "status-sync");
        t.setDaemon(true);
        return t;
    });
    private final Object timerLock = new Object();
    private @Nullable ScheduledFuture<?> pendingTick;
    private volatile boolean running;

    public SyncEngine(
            final ApplicationConfig config,
            final StatusStore store,
            final ChangeSourceRegistry registry,
            final RootManager rootManager,
            final VersionControlClient client,
            final StatusUpdateChannel channel,
            final Clock clock) {
        this.store = store;
        this.registry = registry;
        this.rootManager = rootManager;
        this.client = client;
        this.channel = channel;
        this.clock = clock;
        this.flags = new SyncFlags(clock.instant());
        this.classifier = new ChangeClassifier(config, store, flags, clock);
        this.tickIntervalMs = config.getTickIntervalMs();
        this.rebuildChangeThreshold = config.getRebuildChangeThreshold();
        this.rebuildQuietPeriodMs = config.getRebuildQuietPeriodMs();
        this.incrementalQuietPeriodMs = config.getIncrementalQuietPeriodMs();
    }

    public void start() {
        running = true;
        armTimer();
        logger.info("Status sync started with {}ms tick interval", tickIntervalMs);
    }

    private void armTimer() {
        synchronized (timerLock) {
            if (!running || flags.isBuildInProgress() || pendingTick != null) {
                return;
            }
            pendingTick = tickScheduler.schedule(this::tick, tickIntervalMs, TimeUnit.MILLISECONDS);
        }
    }

    private void tick() {
        synchronized (timerLock) {
            pendingTick = null;
        }
        try {
            runTick();
        } catch (final RuntimeException e) {
            logger.error("Error during status sync tick", e);
        } finally {
            armTimer();
        }
    }

    /**
     * Process one tick: decide between nothing, incremental refresh and full rebuild.
     */
    public TickOutcome runTick() {
        if (flags.isBuildInProgress()) {
            return TickOutcome.SUSPENDED;
        }

        final int changedFiles = registry.changedFileCount();
        final long elapsedMs = Duration.between(registry.latestChangeTime(), clock.instant()).toMillis();

        if (flags.isRebuildRequired() || changedFiles > rebuildChangeThreshold) {
            // Wait for a burst to settle before rebuilding
            if (elapsedMs > rebuildQuietPeriodMs) {
                logger.info("Rebuilding status cache ({} changed files)", changedFiles);
                rebuild();
                channel.fireStatusChanged();
                return TickOutcome.REBUILD;
            }
            return TickOutcome.IDLE;
        }

        if (changedFiles > 0 && elapsedMs > incrementalQuietPeriodMs) {
            logger.debug("Updating dirty files ({} changed files)", changedFiles);
            if (refreshDirtyFiles()) {
                channel.fireStatusChanged();
            }
            return TickOutcome.INCREMENTAL;
        }
        return TickOutcome.IDLE;
    }

    /**
     * Requery every root, parents before nested roots, and swap the result in at once.
     * A root whose query fails keeps the previously cached entries it owns, entries of
     * nested roots excluded.
     */
    void rebuild() {
        flags.clearRebuildRequired();
        flags.markSelfModified(clock.instant());

        // Start from a fresh baseline
        registry.drainAll();

        final List<Path> roots = new ArrayList<>(rootManager.roots());
        roots.sort(Comparator.comparingInt(root -> root.toString().length()));

        final Map<Path, FileStatusRecord> previous = store.snapshot();
        final Map<Path, FileStatusRecord> rebuilt = new HashMap<>();
        for (final Path root : roots) {
            final Optional<Map<Path, Character>> statuses =
                    channel.tryInvoke("Status query of " + root, root, () -> client.queryRootStatus(root));
            if (statuses.isPresent()) {
                logger.debug("Rebuild - {} files in {}", statuses.get().size(), root);
                rebuilt.putAll(StatusStore.toRecords(statuses.get()));
            } else {
                // Entries of nested roots are left to their own query
                for (final Map.Entry<Path, FileStatusRecord> entry : previous.entrySet()) {
                    if (rootManager.rootFor(entry.getKey()).filter(root::equals).isPresent()) {
                        rebuilt.putIfAbsent(entry.getKey(), entry.getValue());
                    }
                }
            }
        }

        store.replace(rebuilt);
        logger.info("Status cache rebuilt: {} files in {} roots", rebuilt.size(), roots.size());
    }

    /**
     * Drain and classify all changed paths and requery the dirty ones.
     *
     * @return true if a status query was issued
     */
    boolean refreshDirtyFiles() {
        final List<Path> dirtyFiles = new ArrayList<>();
        drain:
        for (final DrainedChanges drained : registry.drainAll()) {
            for (final Path path : drained.changes().keySet()) {
                if (classifier.isDirty(path) && !flags.isRebuildRequired()) {
                    dirtyFiles.add(path);
                }
                if (flags.isRebuildRequired()) {
                    break drain;
                }
            }
        }

        if (flags.isRebuildRequired()) {
            logger.debug("Rebuild requested during classification, skipping incremental update");
            return false;
        }
        if (dirtyFiles.isEmpty()) {
            return false;
        }

        // Querying may itself rewrite the repository state file
        flags.markSelfModified(clock.instant());
        final Map<Path, Character> statuses = channel.invoke("Status query of " + dirtyFiles.size() + " files",
                baseDirectoryFor(dirtyFiles), () -> client.queryFileStatus(dirtyFiles));
        logger.debug("Got status for {} of {} dirty files", statuses.size(), dirtyFiles.size());
        store.merge(statuses);
        return true;
    }

    public void enterBuildMode() {
        flags.setBuildInProgress(true);
        synchronized (timerLock) {
            if (pendingTick != null) {
                pendingTick.cancel(false);
                pendingTick = null;
            }
        }
        logger.info("Build started, status sync suspended");
    }

    public void exitBuildMode() {
        flags.setBuildInProgress(false);
        armTimer();
        logger.info("Build finished, status sync resumed");
    }

    public boolean isBuildInProgress() {
        return flags.isBuildInProgress();
    }

    /**
     * Record that the engine is about to write repository metadata.
     */
    public void markSelfModified() {
        flags.markSelfModified(clock.instant());
    }

    /**
     * Request a full rebuild on one of the next ticks.
     */
    public void markCacheDirty() {
        flags.requireRebuild();
    }

    public void setWatchingEnabled(final boolean enabled) {
        registry.setEnabled(enabled);
    }

    public CompletableFuture<Void> addFiles(final Collection<Path> files) {
        final List<Path> fileList = List.copyOf(files);
        if (fileList.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        markSelfModified();
        return channel.submit("Adding " + fileList.size() + " files", baseDirectoryFor(fileList),
                () -> client.addFiles(fileList));
    }

    public CompletableFuture<Void> addFilesNotIgnored(final Collection<Path> files) {
        final List<Path> fileList = List.copyOf(files);
        if (fileList.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        markSelfModified();
        return channel.submit("Adding " + fileList.size() + " not ignored files", baseDirectoryFor(fileList),
                () -> client.addFilesNotIgnored(fileList));
    }

    /**
     * Propagate renames to the repository. Directories and renames that only change the
     * case of the name are skipped. Both names of every propagated pair are evicted from
     * the cache right away.
     */
    public CompletableFuture<Void> propagateRenamed(final List<Path> oldPaths, final List<Path> newPaths) {
        if (oldPaths.size() != newPaths.size()) {
            throw new IllegalArgumentException("Rename lists differ in size: " + oldPaths.size() + " vs " + newPaths.size());
        }

        final List<Path> renamedFrom = new ArrayList<>();
        final List<Path> renamedTo = new ArrayList<>();
        for (int i = 0; i < oldPaths.size(); i++) {
            final Path oldPath = oldPaths.get(i);
            final Path newPath = newPaths.get(i);
            if (Files.isDirectory(newPath)) {
                continue;
            }
            if (!oldPath.toString().equalsIgnoreCase(newPath.toString())) {
                renamedFrom.add(oldPath);
                renamedTo.add(newPath);
            }
        }

        final List<Path> evicted = new ArrayList<>(renamedFrom);
        evicted.addAll(renamedTo);
        store.removeAll(evicted);

        markSelfModified();
        if (renamedFrom.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return channel.submit("Propagating " + renamedFrom.size() + " renames", baseDirectoryFor(renamedTo),
                () -> client.propagateRenamed(renamedFrom, renamedTo));
    }

    /**
     * Evict the files from the cache immediately and propagate their removal.
     */
    public CompletableFuture<Void> propagateRemoved(final Collection<Path> files) {
        final List<Path> fileList = List.copyOf(files);
        store.removeAll(fileList);
        if (fileList.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        markSelfModified();
        return channel.submit("Removing " + fileList.size() + " files", baseDirectoryFor(fileList),
                () -> client.propagateRemoved(fileList));
    }

    public void removeFromCache(final Path path) {
        store.remove(path);
    }

    SyncFlags flags() {
        return flags;
    }

    /**
     * The repository root shared by all files, or null if they span several roots or none.
     * Relative tool results can only be resolved against a shared root.
     */
    private @Nullable Path baseDirectoryFor(final List<Path> files) {
        Path base = null;
        for (final Path file : files) {
            final Optional<Path> root = rootManager.rootFor(file).or(() -> client.findRootDirectory(file));
            if (root.isEmpty() || (base != null && !base.equals(root.get()))) {
                return null;
            }
            base = root.get();
        }
        return base;
    }

    @Override
    public void close() {
        running = false;
        synchronized (timerLock) {
            if (pendingTick != null) {
                pendingTick.cancel(false);
                pendingTick = null;
            }
        }
        tickScheduler.shutdown();
        try {
            if (!tickScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                tickScheduler.shutdownNow();
            }
        } catch (final InterruptedException e) {
            tickScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Status sync stopped");
    }
}
