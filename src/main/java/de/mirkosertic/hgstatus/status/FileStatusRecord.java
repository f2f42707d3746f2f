package de.mirkosertic.hgstatus.status;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable cache entry for one file.
 * <p>
 * Size and modification time are captured from disk when the record is created, so a
 * later change event can be compared against them to detect events without a real change.
 */
public record FileStatusRecord(
        /** Absolute, normalized file path. */
        Path path,
        /** Status character as reported by the version control tool. */
        char statusChar,
        /** File size in bytes at the time the status was recorded, 0 if the file was missing. */
        long size,
        /** Last modification time at the time the status was recorded, epoch if the file was missing. */
        Instant modTime
) {

    public FileStatusRecord {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(modTime, "modTime");
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
    }

    /**
     * Create a record for the given path, reading size and modification time from disk.
     */
    public static FileStatusRecord of(final Path path, final char statusChar) {
        final Optional<BasicFileAttributes> attributes = readAttributes(path);
        if (attributes.isPresent()) {
            return new FileStatusRecord(path, statusChar, attributes.get().size(),
                    attributes.get().lastModifiedTime().toInstant());
        }
        return new FileStatusRecord(path, statusChar, 0, Instant.EPOCH);
    }

    public FileStatus status() {
        return FileStatus.fromStatusChar(statusChar);
    }

    /**
     * True if the given on-disk attributes show the same size and modification time
     * as this record.
     */
    public boolean matches(final BasicFileAttributes attributes) {
        return size == attributes.size() && modTime.equals(attributes.lastModifiedTime().toInstant());
    }

    /**
     * Read the basic attributes of a file. Returns empty if the file does not exist
     * or cannot be read.
     */
    public static Optional<BasicFileAttributes> readAttributes(final Path path) {
        try {
            return Optional.of(Files.readAttributes(path, BasicFileAttributes.class));
        } catch (final IOException e) {
            // Missing or unreadable, treated like a vanished file
            return Optional.empty();
        }
    }
}
