package de.mirkosertic.hgstatus.sync;

import de.mirkosertic.hgstatus.config.ApplicationConfig;
import de.mirkosertic.hgstatus.status.FileStatusRecord;
import de.mirkosertic.hgstatus.status.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Decides whether a raw changed path must be requeried.
 * <p>
 * A change of the repository state file is never queried itself. If it happens more
 * than the self-modification window after the engine's own last metadata write, it was
 * caused externally (e.g. an update to another revision) and a full rebuild is
 * requested instead.
 */
public class ChangeClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ChangeClassifier.class);

    private final StatusStore store;
    private final SyncFlags flags;
    private final Clock clock;
    private final String metadataDirectory;
    private final String stateFile;
    private final long selfModificationWindowMs;

    public ChangeClassifier(final ApplicationConfig config, final StatusStore store, final SyncFlags flags, final Clock clock) {
        this.store = store;
        this.flags = flags;
        this.clock = clock;
        this.metadataDirectory = config.getMetadataDirectory();
        this.stateFile = config.getStateFile();
        this.selfModificationWindowMs = config.getSelfModificationWindowMs();
    }

    /**
     * @return true if the path's cached status may be outdated
     */
    public boolean isDirty(final Path path) {
        if (Files.isDirectory(path)) {
            return false;
        }

        if (isStateFile(path)) {
            final long elapsedMs = Duration.between(flags.getSelfModifiedAt(), clock.instant()).toMillis();
            logger.debug("Repository state changed {}ms after last own modification: {}", elapsedMs, path);
            if (elapsedMs > selfModificationWindowMs) {
                flags.requireRebuild();
                logger.info("External repository change detected, status cache rebuild required");
            }
            return false;
        }

        if (isInsideMetadataDirectory(path)) {
            return false;
        }

        final Optional<FileStatusRecord> cached = store.get(path);
        if (cached.isEmpty()) {
            return true;
        }

        final FileStatusRecord record = cached.get();
        final Optional<BasicFileAttributes> attributes = FileStatusRecord.readAttributes(path);
        if (attributes.isPresent()) {
            return !record.matches(attributes.get());
        }
        // Removed or untracked files may vanish without a status change
        return record.statusChar() != 'R' && record.statusChar() != '?';
    }

    boolean isStateFile(final Path path) {
        final Path fileName = path.getFileName();
        final Path parent = path.getParent();
        return fileName != null && parent != null && parent.getFileName() != null
                && stateFile.equals(fileName.toString())
                && metadataDirectory.equals(parent.getFileName().toString());
    }

    boolean isInsideMetadataDirectory(final Path path) {
        for (final Path element : path) {
            if (metadataDirectory.equals(element.toString())) {
                return true;
            }
        }
        return false;
    }
}
