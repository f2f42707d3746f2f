package de.mirkosertic.hgstatus.sync;

import de.mirkosertic.hgstatus.hg.VersionControlClient;
import de.mirkosertic.hgstatus.watcher.ChangeSourceRegistry;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks the recognized repository roots and starts watching each root on first sight.
 * The set of roots only grows until {@link #clear()}.
 */
public class RootManager {

    private static final Logger logger = LoggerFactory.getLogger(RootManager.class);

    private final VersionControlClient client;
    private final ChangeSourceRegistry registry;
    private final StatusUpdateChannel channel;
    private final Set<Path> roots = new LinkedHashSet<>();

    public RootManager(final VersionControlClient client, final ChangeSourceRegistry registry, final StatusUpdateChannel channel) {
        this.client = client;
        this.registry = registry;
        this.channel = channel;
    }

    /**
     * Register the repository containing the given directory. A new root is watched and
     * its full status is queried asynchronously.
     *
     * @return false only for an empty path; a directory outside any repository adds nothing
     */
    public boolean addRoot(final @Nullable Path directory) {
        if (directory == null || directory.toString().isEmpty()) {
            return false;
        }

        final Optional<Path> detected = client.findRootDirectory(directory);
        if (detected.isEmpty()) {
            logger.debug("No repository found for {}", directory);
            return true;
        }

        final Path root = detected.get().toAbsolutePath().normalize();
        synchronized (roots) {
            if (!roots.add(root)) {
                return true;
            }
        }

        logger.info("Added repository root: {}", root);
        registry.watch(root);
        channel.submit("Initial status query of " + root, root, () -> client.queryRootStatus(root));
        return true;
    }

    /**
     * Add the directory of every named project. Entries with an empty name or directory
     * are skipped.
     */
    public void updateProjects(final Map<String, Path> projects) {
        for (final Map.Entry<String, Path> project : projects.entrySet()) {
            if (project.getKey() != null && !project.getKey().isEmpty()
                    && project.getValue() != null && !project.getValue().toString().isEmpty()) {
                addRoot(project.getValue());
            }
        }
    }

    public boolean hasAnyRoot() {
        return registry.size() > 0;
    }

    public List<Path> roots() {
        synchronized (roots) {
            return new ArrayList<>(roots);
        }
    }

    /**
     * The innermost known root containing the given path.
     */
    public Optional<Path> rootFor(final Path path) {
        final Path normalized = path.toAbsolutePath().normalize();
        Path best = null;
        synchronized (roots) {
            for (final Path root : roots) {
                if (normalized.startsWith(root) && (best == null || root.getNameCount() > best.getNameCount())) {
                    best = root;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    public void clear() {
        synchronized (roots) {
            roots.clear();
        }
    }
}
