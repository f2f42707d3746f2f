package de.mirkosertic.hgstatus.sync;

import java.time.Instant;

/**
 * Shared engine flags. Each field has at most one logical writer at a time; volatile
 * makes writes immediately visible to the tick thread.
 */
public class SyncFlags {

    private volatile boolean rebuildRequired;
    private volatile Instant selfModifiedAt;
    private volatile boolean buildInProgress;

    public SyncFlags(final Instant selfModifiedAt) {
        this.selfModifiedAt = selfModifiedAt;
    }

    public boolean isRebuildRequired() {
        return rebuildRequired;
    }

    public void requireRebuild() {
        rebuildRequired = true;
    }

    /**
     * Reset at the start of a rebuild only.
     */
    void clearRebuildRequired() {
        rebuildRequired = false;
    }

    public Instant getSelfModifiedAt() {
        return selfModifiedAt;
    }

    public void markSelfModified(final Instant now) {
        selfModifiedAt = now;
    }

    public boolean isBuildInProgress() {
        return buildInProgress;
    }

    void setBuildInProgress(final boolean buildInProgress) {
        this.buildInProgress = buildInProgress;
    }
}
