package de.mirkosertic.hgstatus.sync;

import de.mirkosertic.hgstatus.MutableClock;
import de.mirkosertic.hgstatus.TestConfigs;
import de.mirkosertic.hgstatus.status.StatusStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChangeClassifier Tests")
class ChangeClassifierTest {

    private static final Instant START = Instant.parse("2024-01-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private StatusStore store;
    private SyncFlags flags;
    private ChangeClassifier classifier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new StatusStore();
        flags = new SyncFlags(START);
        classifier = new ChangeClassifier(TestConfigs.defaults(), store, flags, clock);
    }

    @Nested
    @DisplayName("Repository metadata")
    class MetadataTests {

        private Path stateFile;

        @BeforeEach
        void setUp() {
            stateFile = tempDir.resolve(".hg").resolve("dirstate");
        }

        @Test
        @DisplayName("Should treat a state file change shortly after an own write as self-caused")
        void ownStateFileChange() {
            clock.advance(Duration.ofMillis(2999));

            assertThat(classifier.isDirty(stateFile)).isFalse();
            assertThat(flags.isRebuildRequired()).isFalse();
        }

        @Test
        @DisplayName("Should not request a rebuild at exactly the self-modification window")
        void windowBoundaryIsSelfCaused() {
            clock.advance(Duration.ofMillis(3000));

            assertThat(classifier.isDirty(stateFile)).isFalse();
            assertThat(flags.isRebuildRequired()).isFalse();
        }

        @Test
        @DisplayName("Should request a rebuild for a state file change after the window")
        void externalStateFileChange() {
            clock.advance(Duration.ofMillis(3001));

            assertThat(classifier.isDirty(stateFile)).isFalse();
            assertThat(flags.isRebuildRequired()).isTrue();
        }

        @Test
        @DisplayName("Should measure the window from the latest own write")
        void windowRestartsOnOwnWrite() {
            clock.advance(Duration.ofSeconds(10));
            flags.markSelfModified(clock.instant());
            clock.advance(Duration.ofMillis(500));

            classifier.isDirty(stateFile);

            assertThat(flags.isRebuildRequired()).isFalse();
        }

        @Test
        @DisplayName("Should ignore other files of the metadata directory")
        void ignoresOtherMetadataFiles() {
            clock.advance(Duration.ofSeconds(10));

            assertThat(classifier.isDirty(tempDir.resolve(".hg").resolve("store").resolve("00changelog.i"))).isFalse();
            assertThat(classifier.isDirty(tempDir.resolve(".hg").resolve("wlock"))).isFalse();
            assertThat(flags.isRebuildRequired()).isFalse();
        }

        @Test
        @DisplayName("Should only recognize the state file directly inside the metadata directory")
        void recognizesStateFile() {
            assertThat(classifier.isStateFile(stateFile)).isTrue();
            assertThat(classifier.isStateFile(tempDir.resolve("src").resolve("dirstate"))).isFalse();
            assertThat(classifier.isStateFile(tempDir.resolve(".hg").resolve("cache").resolve("dirstate"))).isFalse();
        }
    }

    @Nested
    @DisplayName("Working directory files")
    class WorkingFileTests {

        @Test
        @DisplayName("Should never report a directory as dirty")
        void directoryIsNotDirty() throws IOException {
            final Path directory = Files.createDirectories(tempDir.resolve("src"));

            assertThat(classifier.isDirty(directory)).isFalse();
        }

        @Test
        @DisplayName("Should report a file without cached status as dirty")
        void uncachedFileIsDirty() throws IOException {
            final Path file = Files.writeString(tempDir.resolve("new.txt"), "content");

            assertThat(classifier.isDirty(file)).isTrue();
            assertThat(classifier.isDirty(tempDir.resolve("never-existed.txt"))).isTrue();
        }

        @Test
        @DisplayName("Should not report an unchanged cached file as dirty")
        void unchangedFileIsClean() throws IOException {
            final Path file = Files.writeString(tempDir.resolve("a.txt"), "content");
            store.merge(Map.of(file, 'C'));

            assertThat(classifier.isDirty(file)).isFalse();
        }

        @Test
        @DisplayName("Should report a cached file with a different size as dirty")
        void changedFileIsDirty() throws IOException {
            final Path file = Files.writeString(tempDir.resolve("a.txt"), "content");
            store.merge(Map.of(file, 'C'));

            Files.writeString(file, "content that is longer now");

            assertThat(classifier.isDirty(file)).isTrue();
        }

        @ParameterizedTest(name = "status {0}")
        @ValueSource(chars = {'R', '?'})
        @DisplayName("Should not report a vanished removed or untracked file as dirty")
        void vanishedUntrackedFileIsClean(final char status) {
            final Path file = tempDir.resolve("gone.txt");
            store.merge(Map.of(file, status));

            assertThat(classifier.isDirty(file)).isFalse();
        }

        @ParameterizedTest(name = "status {0}")
        @ValueSource(chars = {'C', 'M', 'A', 'N'})
        @DisplayName("Should report a vanished tracked file as dirty")
        void vanishedTrackedFileIsDirty(final char status) {
            final Path file = tempDir.resolve("gone.txt");
            store.merge(Map.of(file, status));

            assertThat(classifier.isDirty(file)).isTrue();
        }
    }
}
