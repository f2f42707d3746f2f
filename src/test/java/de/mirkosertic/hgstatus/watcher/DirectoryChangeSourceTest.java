package de.mirkosertic.hgstatus.watcher;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs against the real file system watch service.
 */
@DisplayName("DirectoryChangeSource Tests")
class DirectoryChangeSourceTest {

    private static final long WAIT_MS = 15000;

    @TempDir
    Path tempDir;

    private DirectoryChangeSource source;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(tempDir.resolve("sub"));
        source = new DirectoryChangeSource(tempDir, 50, Clock.systemUTC());
        source.start();
    }

    @AfterEach
    void tearDown() {
        source.close();
    }

    @Test
    @DisplayName("Should record files created in the root and in subdirectories")
    void recordsCreatedFiles() throws Exception {
        final Path top = Files.writeString(tempDir.resolve("top.txt"), "a");
        final Path nested = Files.writeString(tempDir.resolve("sub").resolve("nested.txt"), "b");

        waitUntilChanged(2);

        final Map<Path, Instant> drained = source.drainDirtyMap();
        assertThat(drained).containsKeys(top, nested);
        assertThat(source.latestEventTime()).isPresent();
        assertThat(source.changedCount()).isZero();
    }

    @Test
    @DisplayName("Should watch directories created after start")
    void watchesNewDirectories() throws Exception {
        final Path created = Files.createDirectory(tempDir.resolve("later"));
        waitUntilChanged(1);
        // Give the watcher time to register the new directory
        Thread.sleep(300);
        source.drainDirtyMap();

        final Path file = Files.writeString(created.resolve("file.txt"), "c");

        waitUntilChanged(1);
        assertThat(source.drainDirtyMap()).containsKey(file);
    }

    @Test
    @DisplayName("Should not record changes while disabled")
    void ignoresChangesWhileDisabled() throws Exception {
        source.setEnabled(false);

        Files.writeString(tempDir.resolve("silent.txt"), "d");
        Thread.sleep(500);

        assertThat(source.changedCount()).isZero();
        assertThat(source.latestEventTime()).isEmpty();
    }

    @Test
    @DisplayName("Should collapse repeated changes of one file into one entry")
    void collapsesRepeatedChanges() throws Exception {
        final Path file = tempDir.resolve("busy.txt");
        for (int i = 0; i < 5; i++) {
            Files.writeString(file, "v" + i);
        }

        waitUntilChanged(1);
        Thread.sleep(200);

        assertThat(source.drainDirtyMap()).containsOnlyKeys(file);
    }

    private void waitUntilChanged(final int expected) throws InterruptedException {
        final long deadline = System.currentTimeMillis() + WAIT_MS;
        while (source.changedCount() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(source.changedCount()).isGreaterThanOrEqualTo(expected);
    }
}
