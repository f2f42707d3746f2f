package de.mirkosertic.hgstatus.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link CallbackDispatcher} running every callback on a single daemon thread.
 */
public class SingleThreadCallbackDispatcher implements CallbackDispatcher, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SingleThreadCallbackDispatcher.class);

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        final Thread thread = new Thread(r, "status-notify");
        thread.setDaemon(true);
        return thread;
    });

    @Override
    public void post(final Runnable callback) {
        try {
            executor.execute(() -> {
                try {
                    callback.run();
                } catch (final RuntimeException e) {
                    logger.error("Error in status callback", e);
                }
            });
        } catch (final RejectedExecutionException e) {
            logger.debug("Dispatcher already shut down, dropping callback");
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
