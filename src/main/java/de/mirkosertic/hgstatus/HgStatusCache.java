package de.mirkosertic.hgstatus;

import de.mirkosertic.hgstatus.config.ApplicationConfig;
import de.mirkosertic.hgstatus.hg.MercurialClient;
import de.mirkosertic.hgstatus.hg.VersionControlClient;
import de.mirkosertic.hgstatus.status.FileStatus;
import de.mirkosertic.hgstatus.status.FileStatusRecord;
import de.mirkosertic.hgstatus.status.StatusStore;
import de.mirkosertic.hgstatus.sync.CallbackDispatcher;
import de.mirkosertic.hgstatus.sync.RootManager;
import de.mirkosertic.hgstatus.sync.SingleThreadCallbackDispatcher;
import de.mirkosertic.hgstatus.sync.StatusChangedListener;
import de.mirkosertic.hgstatus.sync.StatusUpdateChannel;
import de.mirkosertic.hgstatus.sync.SyncEngine;
import de.mirkosertic.hgstatus.watcher.ChangeSourceFactory;
import de.mirkosertic.hgstatus.watcher.ChangeSourceRegistry;
import de.mirkosertic.hgstatus.watcher.DirectoryChangeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Status cache as seen by the host: file status queries, root registration,
 * repository-mutating operations, build mode and change notifications.
 */
public class HgStatusCache implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(HgStatusCache.class);

    private final ApplicationConfig config;
    private final StatusStore store;
    private final ChangeSourceRegistry registry;
    private final RootManager rootManager;
    private final StatusUpdateChannel channel;
    private final SyncEngine engine;
    private final ExecutorService toolExecutor;
    private final CallbackDispatcher dispatcher;

    public HgStatusCache(final ApplicationConfig config) {
        this(config,
                new MercurialClient(config),
                root -> new DirectoryChangeSource(root, config.getWatchPollIntervalMs(), Clock.systemUTC()),
                new SingleThreadCallbackDispatcher(),
                Clock.systemUTC());
    }

    public HgStatusCache(
            final ApplicationConfig config,
            final VersionControlClient client,
            final ChangeSourceFactory changeSourceFactory,
            final CallbackDispatcher dispatcher,
            final Clock clock) {
        this.config = config;
        this.dispatcher = dispatcher;
        final AtomicInteger threadCounter = new AtomicInteger(0);
        this.toolExecutor = Executors.newFixedThreadPool(Math.max(1, config.getWorkerThreads()), r -> {
            final Thread thread = new Thread(r, "hg-worker-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });

        this.store = new StatusStore();
        this.registry = new ChangeSourceRegistry(changeSourceFactory, clock);
        this.channel = new StatusUpdateChannel(store, dispatcher, toolExecutor);
        this.rootManager = new RootManager(client, registry, channel);
        this.engine = new SyncEngine(config, store, registry, rootManager, client, channel, clock);
    }

    public void start() {
        registry.setEnabled(config.isWatchEnabled());
        engine.start();
    }

    public FileStatus getFileStatus(final Path path) {
        return store.get(path).map(FileStatusRecord::status).orElse(FileStatus.UNCONTROLLED);
    }

    public Optional<FileStatusRecord> getFileStatusInfo(final Path path) {
        return store.get(path);
    }

    public boolean addRoot(final Path directory) {
        return rootManager.addRoot(directory);
    }

    public void updateProjects(final Map<String, Path> projects) {
        rootManager.updateProjects(projects);
    }

    public boolean hasAnyRoot() {
        return rootManager.hasAnyRoot();
    }

    public List<Path> roots() {
        return rootManager.roots();
    }

    public CompletableFuture<Void> addFiles(final Collection<Path> files) {
        return engine.addFiles(files);
    }

    public CompletableFuture<Void> addFilesNotIgnored(final Collection<Path> files) {
        return engine.addFilesNotIgnored(files);
    }

    public CompletableFuture<Void> propagateRenamed(final List<Path> oldPaths, final List<Path> newPaths) {
        return engine.propagateRenamed(oldPaths, newPaths);
    }

    public CompletableFuture<Void> propagateRemoved(final Collection<Path> files) {
        return engine.propagateRemoved(files);
    }

    public void removeFromCache(final Path path) {
        engine.removeFromCache(path);
    }

    public void enterBuildMode() {
        engine.enterBuildMode();
    }

    public void exitBuildMode() {
        engine.exitBuildMode();
    }

    public void markSelfModified() {
        engine.markSelfModified();
    }

    public void markCacheDirty() {
        engine.markCacheDirty();
    }

    public void setWatchingEnabled(final boolean enabled) {
        engine.setWatchingEnabled(enabled);
    }

    public void onStatusChanged(final StatusChangedListener listener) {
        channel.onStatusChanged(listener);
    }

    public Map<Path, FileStatusRecord> snapshot() {
        return store.snapshot();
    }

    /**
     * Stop watching and forget all roots and cached statuses.
     */
    public void clearAll() {
        registry.unsubscribeAll();
        rootManager.clear();
        store.clear();
        logger.info("Status cache cleared");
    }

    @Override
    public void close() {
        engine.close();
        clearAll();
        toolExecutor.shutdown();
        try {
            if (!toolExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                toolExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            toolExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (dispatcher instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (final Exception e) {
                logger.error("Error closing callback dispatcher", e);
            }
        }
    }
}
