package de.mirkosertic.hgstatus;

import de.mirkosertic.hgstatus.config.ApplicationConfig;

import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mocked {@link ApplicationConfig} carrying the default settings.
 */
public final class TestConfigs {

    private TestConfigs() {
    }

    public static ApplicationConfig defaults() {
        final ApplicationConfig config = mock(ApplicationConfig.class);
        when(config.getTickIntervalMs()).thenReturn(300L);
        when(config.getRebuildChangeThreshold()).thenReturn(200);
        when(config.getRebuildQuietPeriodMs()).thenReturn(1000L);
        when(config.getIncrementalQuietPeriodMs()).thenReturn(100L);
        when(config.getSelfModificationWindowMs()).thenReturn(3000L);
        when(config.isWatchEnabled()).thenReturn(true);
        when(config.getWatchPollIntervalMs()).thenReturn(100L);
        when(config.getHgExecutable()).thenReturn("hg");
        when(config.getMetadataDirectory()).thenReturn(".hg");
        when(config.getStateFile()).thenReturn("dirstate");
        when(config.getWorkerThreads()).thenReturn(2);
        when(config.getRoots()).thenReturn(List.of());
        return config;
    }
}
