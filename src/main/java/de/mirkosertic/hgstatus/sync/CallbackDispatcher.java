package de.mirkosertic.hgstatus.sync;

/**
 * Delivers callbacks on one designated logical thread, in posting order.
 */
@FunctionalInterface
public interface CallbackDispatcher {

    void post(Runnable callback);
}
