package de.mirkosertic.hgstatus.hg;

import de.mirkosertic.hgstatus.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link VersionControlClient} running the Mercurial command line tool.
 * <p>
 * Every command runs with the repository root as working directory and {@code HGPLAIN}
 * set, so output is stable and paths are printed relative to the root. File lists are
 * split by repository root, one invocation per root.
 */
public class MercurialClient implements VersionControlClient {

    private static final Logger logger = LoggerFactory.getLogger(MercurialClient.class);

    private final String executable;
    private final String metadataDirectory;

    public MercurialClient(final ApplicationConfig config) {
        this.executable = config.getHgExecutable();
        this.metadataDirectory = config.getMetadataDirectory();
    }

    @Override
    public Optional<Path> findRootDirectory(final Path path) {
        Path current = path.toAbsolutePath().normalize();
        if (!Files.isDirectory(current)) {
            current = current.getParent();
        }
        while (current != null) {
            if (Files.isDirectory(current.resolve(metadataDirectory))) {
                return Optional.of(current);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    @Override
    public Map<Path, Character> queryRootStatus(final Path root) throws VersionControlException {
        final String output = run(root, List.of("status", "-A", "-C"));
        final Map<Path, Character> result = MercurialStatusParser.parse(output, root);
        logger.debug("Status of root {}: {} files", root, result.size());
        return result;
    }

    @Override
    public Map<Path, Character> queryFileStatus(final Collection<Path> files) throws VersionControlException {
        final Map<Path, Character> result = new LinkedHashMap<>();
        for (final Map.Entry<Path, List<Path>> group : groupByRoot(files).entrySet()) {
            result.putAll(status(group.getKey(), group.getValue(), "-A", "-C"));
        }
        return result;
    }

    @Override
    public Map<Path, Character> addFiles(final Collection<Path> files) throws VersionControlException {
        final Map<Path, Character> result = new LinkedHashMap<>();
        for (final Map.Entry<Path, List<Path>> group : groupByRoot(files).entrySet()) {
            runWithFiles(group.getKey(), List.of("add"), group.getValue());
            result.putAll(status(group.getKey(), group.getValue(), "-A", "-C"));
        }
        return result;
    }

    @Override
    public Map<Path, Character> addFilesNotIgnored(final Collection<Path> files) throws VersionControlException {
        final Map<Path, Character> result = new LinkedHashMap<>();
        for (final Map.Entry<Path, List<Path>> group : groupByRoot(files).entrySet()) {
            final Path root = group.getKey();
            final Set<Path> ignored = new HashSet<>(status(root, group.getValue(), "-i").keySet());
            final List<Path> toAdd = new ArrayList<>();
            for (final Path file : group.getValue()) {
                if (!ignored.contains(file.toAbsolutePath().normalize())) {
                    toAdd.add(file);
                }
            }
            if (!toAdd.isEmpty()) {
                runWithFiles(root, List.of("add"), toAdd);
            }
            result.putAll(status(root, group.getValue(), "-A", "-C"));
        }
        return result;
    }

    @Override
    public Map<Path, Character> propagateRenamed(final List<Path> oldPaths, final List<Path> newPaths)
            throws VersionControlException {
        if (oldPaths.size() != newPaths.size()) {
            throw new IllegalArgumentException("Rename lists differ in size: " + oldPaths.size() + " vs " + newPaths.size());
        }
        final Map<Path, Character> result = new LinkedHashMap<>();
        for (int i = 0; i < oldPaths.size(); i++) {
            final Path newPath = newPaths.get(i);
            final Optional<Path> root = findRootDirectory(newPath);
            if (root.isEmpty()) {
                logger.debug("Rename target outside of any repository: {}", newPath);
                continue;
            }
            final List<Path> pair = List.of(oldPaths.get(i), newPath);
            runWithFiles(root.get(), List.of("rename", "--after"), pair);
            result.putAll(status(root.get(), pair, "-A", "-C"));
        }
        return result;
    }

    @Override
    public Map<Path, Character> propagateRemoved(final Collection<Path> files) throws VersionControlException {
        final Map<Path, Character> result = new LinkedHashMap<>();
        for (final Map.Entry<Path, List<Path>> group : groupByRoot(files).entrySet()) {
            runWithFiles(group.getKey(), List.of("remove", "--after"), group.getValue());
            result.putAll(status(group.getKey(), group.getValue(), "-A", "-C"));
        }
        return result;
    }

    private Map<Path, Character> status(final Path root, final List<Path> files, final String... flags)
            throws VersionControlException {
        final List<String> arguments = new ArrayList<>();
        arguments.add("status");
        arguments.addAll(List.of(flags));
        return MercurialStatusParser.parse(runWithFiles(root, arguments, files), root);
    }

    private Map<Path, List<Path>> groupByRoot(final Collection<Path> files) {
        final Map<Path, List<Path>> groups = new LinkedHashMap<>();
        for (final Path file : files) {
            final Optional<Path> root = findRootDirectory(file);
            if (root.isPresent()) {
                groups.computeIfAbsent(root.get(), r -> new ArrayList<>()).add(file);
            } else {
                logger.debug("File outside of any repository: {}", file);
            }
        }
        return groups;
    }

    private String runWithFiles(final Path root, final List<String> arguments, final List<Path> files)
            throws VersionControlException {
        final List<String> command = new ArrayList<>(arguments);
        command.add("--");
        for (final Path file : files) {
            command.add(root.relativize(file.toAbsolutePath().normalize()).toString());
        }
        return run(root, command);
    }

    String run(final Path workingDirectory, final List<String> arguments) throws VersionControlException {
        final List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--noninteractive");
        command.addAll(arguments);

        final ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDirectory.toFile());
        pb.environment().put("HGPLAIN", "1");

        final Process process;
        try {
            process = pb.start();
        } catch (final IOException e) {
            throw new VersionControlException("Failed to launch " + executable + " in " + workingDirectory, e);
        }

        try {
            final CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
            final String stdout = readFully(process.getInputStream());
            final int exitCode = process.waitFor();
            if (exitCode > 1) {
                throw new VersionControlException("Command " + command + " failed with exit code "
                        + exitCode + ": " + stderr.get().trim());
            }
            // Exit code 1 means some of the given files were skipped
            if (exitCode == 1) {
                logger.warn("Command {} partially failed: {}", command, stderr.get().trim());
            }
            logger.trace("Command {} finished in {}", command, workingDirectory);
            return stdout;
        } catch (final InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new VersionControlException("Interrupted while running " + command, e);
        } catch (final ExecutionException | UncheckedIOException e) {
            throw new VersionControlException("Failed to read output of " + command, e);
        }
    }

    private static String readFully(final InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
