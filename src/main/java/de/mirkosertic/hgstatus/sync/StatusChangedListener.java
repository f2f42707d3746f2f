package de.mirkosertic.hgstatus.sync;

/**
 * Notified on the dispatcher thread whenever cached statuses may have changed.
 */
@FunctionalInterface
public interface StatusChangedListener {

    void statusChanged();
}
