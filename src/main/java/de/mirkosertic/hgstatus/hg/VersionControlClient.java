package de.mirkosertic.hgstatus.hg;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operations consumed from the external version control tool.
 * <p>
 * Every operation is synchronous and blocks the calling thread. Status results map a
 * file path to a single status character ({@code C, M, A, R, I, N, ?}). Paths should
 * be absolute. A relative path is only accepted when all queried files belong to one
 * repository root and is interpreted relative to that root; otherwise it is dropped.
 */
public interface VersionControlClient {

    /**
     * Find the nearest enclosing repository root of the given path.
     */
    Optional<Path> findRootDirectory(Path path);

    Map<Path, Character> queryRootStatus(Path root) throws VersionControlException;

    Map<Path, Character> queryFileStatus(Collection<Path> files) throws VersionControlException;

    Map<Path, Character> addFiles(Collection<Path> files) throws VersionControlException;

    /**
     * Add the given files, skipping those matched by the repository ignore rules.
     */
    Map<Path, Character> addFilesNotIgnored(Collection<Path> files) throws VersionControlException;

    /**
     * Record that each old path has been renamed to the new path at the same index.
     */
    Map<Path, Character> propagateRenamed(List<Path> oldPaths, List<Path> newPaths) throws VersionControlException;

    /**
     * Record that the given files have been removed from the working copy.
     */
    Map<Path, Character> propagateRemoved(Collection<Path> files) throws VersionControlException;
}
