package de.mirkosertic.hgstatus.sync;

import de.mirkosertic.hgstatus.hg.VersionControlException;
import de.mirkosertic.hgstatus.status.StatusStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * Completion channel for version control tool invocations.
 * <p>
 * Runs tool calls on the worker executor, merges their results into the
 * {@link StatusStore} and posts a status-changed notification through the
 * {@link CallbackDispatcher}. Tool failures are logged and contribute an empty result,
 * leaving cached entries untouched.
 */
public class StatusUpdateChannel {

    private static final Logger logger = LoggerFactory.getLogger(StatusUpdateChannel.class);

    /**
     * A single blocking invocation of the version control tool.
     */
    @FunctionalInterface
    public interface ToolCall {
        Map<Path, Character> invoke() throws VersionControlException;
    }

    private final StatusStore store;
    private final CallbackDispatcher dispatcher;
    private final Executor toolExecutor;
    private final List<StatusChangedListener> listeners = new CopyOnWriteArrayList<>();

    public StatusUpdateChannel(final StatusStore store, final CallbackDispatcher dispatcher, final Executor toolExecutor) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.toolExecutor = toolExecutor;
    }

    public void onStatusChanged(final StatusChangedListener listener) {
        listeners.add(listener);
    }

    /**
     * Run the call asynchronously; on completion merge its result and notify once.
     *
     * @param operation   name used in log messages
     * @param baseDirectory root relative result paths are resolved against, or null if
     *                      the call spans several roots
     * @return completes after the result was merged and the notification was posted
     */
    public CompletableFuture<Void> submit(final String operation, final @Nullable Path baseDirectory, final ToolCall call) {
        return CompletableFuture
                .supplyAsync(() -> invoke(operation, baseDirectory, call), toolExecutor)
                .thenAccept(result -> {
                    store.merge(result);
                    fireStatusChanged();
                });
    }

    /**
     * Run the call on the current thread. Failures yield an empty mapping.
     */
    public Map<Path, Character> invoke(final String operation, final @Nullable Path baseDirectory, final ToolCall call) {
        return tryInvoke(operation, baseDirectory, call).orElse(Map.of());
    }

    /**
     * Run the call on the current thread. Empty if the tool failed, so callers can tell
     * a failure apart from an empty answer.
     */
    public Optional<Map<Path, Character>> tryInvoke(final String operation, final @Nullable Path baseDirectory,
                                                    final ToolCall call) {
        try {
            return Optional.of(resolve(baseDirectory, call.invoke()));
        } catch (final VersionControlException e) {
            logger.warn("{} failed, keeping cached status: {}", operation, e.getMessage());
            logger.debug("{} failure details", operation, e);
            return Optional.empty();
        } catch (final RuntimeException e) {
            logger.error("Unexpected error during {}", operation, e);
            return Optional.empty();
        }
    }

    public void fireStatusChanged() {
        if (listeners.isEmpty()) {
            return;
        }
        dispatcher.post(() -> {
            for (final StatusChangedListener listener : listeners) {
                try {
                    listener.statusChanged();
                } catch (final RuntimeException e) {
                    logger.error("Status listener failed", e);
                }
            }
        });
    }

    static Map<Path, Character> resolve(final @Nullable Path baseDirectory, final Map<Path, Character> result) {
        final Map<Path, Character> resolved = new LinkedHashMap<>();
        for (final Map.Entry<Path, Character> entry : result.entrySet()) {
            Path path = entry.getKey();
            if (!path.isAbsolute()) {
                if (baseDirectory == null) {
                    logger.warn("Dropping relative status result without a single owning root: {}", path);
                    continue;
                }
                path = baseDirectory.resolve(path);
            }
            resolved.put(path.normalize(), entry.getValue());
        }
        return resolved;
    }
}
