package de.mirkosertic.hgstatus.hg;

/**
 * Failure of an invocation of the version control tool: launch error, non-zero exit,
 * malformed output or interruption.
 */
public class VersionControlException extends Exception {

    public VersionControlException(final String message) {
        super(message);
    }

    public VersionControlException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
