package de.mirkosertic.hgstatus.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Selects the logback configuration for the run mode.
 * <p>
 * Console mode keeps logback.xml, which logback loads automatically. Daemon mode
 * switches to logback-daemon.xml, writing a rolling log below ~/.hgstatus/log.
 */
public final class LoggingConfigurator {

    private static final String DAEMON_CONFIG = "logback-daemon.xml";
    private static final String LOG_DIR_PROPERTY = "HGSTATUS_LOG_DIR";

    private LoggingConfigurator() {
    }

    /**
     * Must run before the first logger is used.
     *
     * @param daemonMode true to log to file only
     */
    public static void configure(final boolean daemonMode) {
        if (!daemonMode) {
            return;
        }
        final Path logDirectory = ApplicationConfig.getConfigDirectory().resolve("log");
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory: " + logDirectory);
        }
        reconfigure(DAEMON_CONFIG, logDirectory);
    }

    private static void reconfigure(final String configFile, final Path logDirectory) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return;
            }
            context.reset();
            context.putProperty(LOG_DIR_PROPERTY, logDirectory.toString());

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        }
    }
}
