package de.mirkosertic.hgstatus.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration of the status cache.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.hgstatus/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_ROOTS = "HGSTATUS_ROOTS";
    private static final String ENV_HG_EXECUTABLE = "HGSTATUS_HG_EXECUTABLE";
    private static final String PROP_HG_EXECUTABLE = "hgstatus.hg.executable";
    private static final String PROP_MODE = "hgstatus.mode";
    private static final String CONFIG_DIR = ".hgstatus";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Sync engine settings
    private long tickIntervalMs = 300;
    private int rebuildChangeThreshold = 200;
    private long rebuildQuietPeriodMs = 1000;
    private long incrementalQuietPeriodMs = 100;
    private long selfModificationWindowMs = 3000;

    // Watcher settings
    private boolean watchEnabled = true;
    private long watchPollIntervalMs = 500;

    // Mercurial settings
    private String hgExecutable = "hg";
    private String metadataDirectory = ".hg";
    private String stateFile = "dirstate";
    private int workerThreads = 2;

    private List<String> roots = new ArrayList<>();

    private boolean daemonMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(getUserConfigPath());
    }

    static ApplicationConfig load(final Path userConfigPath) {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig(userConfigPath);
        config.applyEnvironmentOverrides();
        config.determineMode();

        logger.info("Configuration loaded: hg={}, roots={}, tickIntervalMs={}, daemonMode={}",
                config.hgExecutable, config.roots.size(), config.tickIntervalMs, config.daemonMode);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig(final Path userConfigPath) {
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> statusConfig = (Map<String, Object>) config.get("hgstatus");
        if (statusConfig == null) {
            return;
        }

        if (statusConfig.get("roots") instanceof List) {
            this.roots = new ArrayList<>();
            for (final Object root : (List<Object>) statusConfig.get("roots")) {
                this.roots.add(String.valueOf(root));
            }
        }

        final Map<String, Object> syncConfig = (Map<String, Object>) statusConfig.get("sync");
        if (syncConfig != null) {
            applySyncConfig(syncConfig);
        }

        final Map<String, Object> watcherConfig = (Map<String, Object>) statusConfig.get("watcher");
        if (watcherConfig != null) {
            if (watcherConfig.containsKey("enabled")) {
                this.watchEnabled = (Boolean) watcherConfig.get("enabled");
            }
            if (watcherConfig.containsKey("poll-interval-ms")) {
                this.watchPollIntervalMs = ((Number) watcherConfig.get("poll-interval-ms")).longValue();
            }
        }

        final Map<String, Object> hgConfig = (Map<String, Object>) statusConfig.get("hg");
        if (hgConfig != null) {
            applyHgConfig(hgConfig);
        }
    }

    private void applySyncConfig(final Map<String, Object> syncConfig) {
        if (syncConfig.containsKey("tick-interval-ms")) {
            this.tickIntervalMs = ((Number) syncConfig.get("tick-interval-ms")).longValue();
        }
        if (syncConfig.containsKey("rebuild-change-threshold")) {
            this.rebuildChangeThreshold = ((Number) syncConfig.get("rebuild-change-threshold")).intValue();
        }
        if (syncConfig.containsKey("rebuild-quiet-period-ms")) {
            this.rebuildQuietPeriodMs = ((Number) syncConfig.get("rebuild-quiet-period-ms")).longValue();
        }
        if (syncConfig.containsKey("incremental-quiet-period-ms")) {
            this.incrementalQuietPeriodMs = ((Number) syncConfig.get("incremental-quiet-period-ms")).longValue();
        }
        if (syncConfig.containsKey("self-modification-window-ms")) {
            this.selfModificationWindowMs = ((Number) syncConfig.get("self-modification-window-ms")).longValue();
        }
    }

    private void applyHgConfig(final Map<String, Object> hgConfig) {
        if (hgConfig.containsKey("executable")) {
            this.hgExecutable = String.valueOf(hgConfig.get("executable"));
        }
        if (hgConfig.containsKey("metadata-directory")) {
            this.metadataDirectory = String.valueOf(hgConfig.get("metadata-directory"));
        }
        if (hgConfig.containsKey("state-file")) {
            this.stateFile = String.valueOf(hgConfig.get("state-file"));
        }
        if (hgConfig.containsKey("worker-threads")) {
            this.workerThreads = ((Number) hgConfig.get("worker-threads")).intValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String propExecutable = System.getProperty(PROP_HG_EXECUTABLE);
        if (propExecutable != null && !propExecutable.isBlank()) {
            this.hgExecutable = propExecutable.trim();
        }

        final String envExecutable = System.getenv(ENV_HG_EXECUTABLE);
        if (envExecutable != null && !envExecutable.isBlank()) {
            this.hgExecutable = envExecutable.trim();
            logger.info("Mercurial executable from environment: {}", this.hgExecutable);
        }

        // Roots from environment override all other sources
        final String envRoots = System.getenv(ENV_ROOTS);
        if (envRoots != null && !envRoots.isBlank()) {
            this.roots = new ArrayList<>();
            for (final String root : envRoots.split(",")) {
                final String trimmed = root.trim();
                if (!trimmed.isEmpty()) {
                    this.roots.add(trimmed);
                }
            }
            logger.info("Roots from environment: {}", this.roots);
        }
    }

    private void determineMode() {
        this.daemonMode = isDaemonModeRequested();
    }

    /**
     * Whether daemon mode was requested with {@code -Dhgstatus.mode=daemon}. Usable before
     * the configuration is loaded, so logging can be set up first.
     */
    public static boolean isDaemonModeRequested() {
        return "daemon".equalsIgnoreCase(System.getProperty(PROP_MODE, "console"));
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    public int getRebuildChangeThreshold() {
        return rebuildChangeThreshold;
    }

    public long getRebuildQuietPeriodMs() {
        return rebuildQuietPeriodMs;
    }

    public long getIncrementalQuietPeriodMs() {
        return incrementalQuietPeriodMs;
    }

    public long getSelfModificationWindowMs() {
        return selfModificationWindowMs;
    }

    public boolean isWatchEnabled() {
        return watchEnabled;
    }

    public long getWatchPollIntervalMs() {
        return watchPollIntervalMs;
    }

    public String getHgExecutable() {
        return hgExecutable;
    }

    public String getMetadataDirectory() {
        return metadataDirectory;
    }

    public String getStateFile() {
        return stateFile;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public List<String> getRoots() {
        return roots;
    }

    public boolean isDaemonMode() {
        return daemonMode;
    }
}
