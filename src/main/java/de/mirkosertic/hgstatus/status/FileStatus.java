package de.mirkosertic.hgstatus.status;

/**
 * Source control status of a single file as exposed to the host.
 * <p>
 * A file that is unknown to the cache is always {@link #UNCONTROLLED}.
 */
public enum FileStatus {

    UNCONTROLLED,
    CONTROLLED,
    MODIFIED,
    ADDED,
    REMOVED,
    RENAMED,
    IGNORED;

    /**
     * Map a status character as reported by the version control tool.
     * Unknown characters, including {@code '?'}, map to {@link #UNCONTROLLED}.
     */
    public static FileStatus fromStatusChar(final char statusChar) {
        return switch (statusChar) {
            case 'C' -> CONTROLLED;
            case 'M' -> MODIFIED;
            case 'A' -> ADDED;
            case 'R' -> REMOVED;
            case 'I' -> IGNORED;
            case 'N' -> RENAMED;
            default -> UNCONTROLLED;
        };
    }
}
