package de.mirkosertic.hgstatus.sync;

/**
 * What a single tick of the {@link SyncEngine} did.
 */
public enum TickOutcome {
    /** Ticking is suspended while a build runs. */
    SUSPENDED,
    /** Nothing to do, or still waiting for changes to settle. */
    IDLE,
    /** Dirty paths were drained and classified; at most one file query was issued. */
    INCREMENTAL,
    /** The whole cache was requeried and replaced. */
    REBUILD
}
