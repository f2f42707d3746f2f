package de.mirkosertic.hgstatus.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StatusStore Tests")
class StatusStoreTest {

    @TempDir
    Path tempDir;

    private StatusStore store;

    @BeforeEach
    void setUp() {
        store = new StatusStore();
    }

    @Test
    @DisplayName("Merging the same mapping twice equals merging it once")
    void mergeIsIdempotent() throws IOException {
        final Path file = Files.writeString(tempDir.resolve("a.txt"), "content");
        final Map<Path, Character> statuses = Map.of(file, 'M', tempDir.resolve("gone.txt"), 'R');

        store.merge(statuses);
        final Map<Path, FileStatusRecord> once = store.snapshot();
        store.merge(statuses);

        assertThat(store.snapshot()).isEqualTo(once);
        assertThat(store.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Later merge wins for the same path")
    void laterMergeWins() {
        final Path file = tempDir.resolve("a.txt");

        store.merge(Map.of(file, 'A'));
        store.merge(Map.of(file, 'C'));

        assertThat(store.get(file)).map(FileStatusRecord::status).contains(FileStatus.CONTROLLED);
    }

    @Test
    @DisplayName("Merge captures size and modification time from disk")
    void mergeCapturesFileAttributes() throws IOException {
        final Path file = Files.writeString(tempDir.resolve("sized.txt"), "0123456789");

        store.merge(Map.of(file, 'C'));

        final FileStatusRecord record = store.get(file).orElseThrow();
        assertThat(record.size()).isEqualTo(10);
        assertThat(record.modTime()).isEqualTo(Files.getLastModifiedTime(file).toInstant());
    }

    @Test
    @DisplayName("Missing files are recorded with zero size and epoch time")
    void mergeOfMissingFile() {
        final Path missing = tempDir.resolve("missing.txt");

        store.merge(Map.of(missing, 'R'));

        final FileStatusRecord record = store.get(missing).orElseThrow();
        assertThat(record.size()).isZero();
        assertThat(record.modTime()).isEqualTo(Instant.EPOCH);
    }

    @Test
    @DisplayName("Replace drops every path not contained in the new mapping")
    void replaceNeverUnions() {
        final Path old = tempDir.resolve("old.txt");
        final Path kept = tempDir.resolve("kept.txt");
        store.merge(Map.of(old, 'C', kept, 'C'));

        store.replace(StatusStore.toRecords(Map.of(kept, 'M')));

        assertThat(store.get(old)).isEmpty();
        assertThat(store.get(kept)).map(FileStatusRecord::statusChar).contains('M');
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Removing absent paths is a no-op")
    void removeIsIdempotent() {
        final Path file = tempDir.resolve("a.txt");
        store.merge(Map.of(file, 'C'));

        store.remove(file);
        store.remove(file);
        store.removeAll(List.of(file, tempDir.resolve("never.txt")));

        assertThat(store.get(file)).isEmpty();
        assertThat(store.count()).isZero();
    }

    @Test
    @DisplayName("Snapshot is detached from later mutations")
    void snapshotIsImmutableCopy() {
        final Path file = tempDir.resolve("a.txt");
        store.merge(Map.of(file, 'C'));

        final Map<Path, FileStatusRecord> snapshot = store.snapshot();
        store.clear();

        assertThat(snapshot).containsKey(file);
        assertThat(store.count()).isZero();
        assertThatThrownBy(() -> snapshot.remove(file)).isInstanceOf(UnsupportedOperationException.class);
    }
}
