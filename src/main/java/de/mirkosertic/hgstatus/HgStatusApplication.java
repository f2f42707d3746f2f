package de.mirkosertic.hgstatus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.hgstatus.config.ApplicationConfig;
import de.mirkosertic.hgstatus.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line entry point. Watches the directories given as arguments (or the
 * configured roots) and logs a status report whenever cached statuses change.
 */
public class HgStatusApplication {

    private static final Logger logger = LoggerFactory.getLogger(HgStatusApplication.class);

    private final HgStatusCache statusCache;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HgStatusApplication(final HgStatusCache statusCache) {
        this.statusCache = statusCache;
    }

    public void start(final List<String> directories) {
        statusCache.onStatusChanged(this::logReport);
        statusCache.start();

        for (final String directory : directories) {
            final Path path = Paths.get(directory);
            statusCache.addRoot(path);
        }
        if (!statusCache.hasAnyRoot()) {
            logger.warn("No repository found in {}", directories);
        }
    }

    void logReport() {
        final StatusReport report = StatusReport.of(statusCache.roots().size(), statusCache.snapshot());
        try {
            logger.info("Status changed: {}", objectMapper.writeValueAsString(report));
        } catch (final JsonProcessingException e) {
            logger.warn("Failed to render status report", e);
        }
    }

    public void shutdown() {
        logger.info("Shutting down status cache...");
        try {
            statusCache.close();
        } catch (final Exception e) {
            logger.error("Error closing status cache", e);
        }
        logger.info("Status cache shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Configure logging first, before any other code that might log
            LoggingConfigurator.configure(ApplicationConfig.isDaemonModeRequested());

            final ApplicationConfig config = ApplicationConfig.load();
            final List<String> directories = args.length > 0 ? List.of(args) : config.getRoots();
            if (directories.isEmpty()) {
                System.err.println("Usage: hg-status-cache <directory>... (or configure hgstatus.roots)");
                System.exit(2);
            }

            final HgStatusApplication app = new HgStatusApplication(new HgStatusCache(config));
            Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "shutdown-hook"));
            app.start(directories);

            // Watching happens on daemon threads; keep the main thread alive
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        } catch (final Exception e) {
            System.err.println("Failed to start status cache: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
