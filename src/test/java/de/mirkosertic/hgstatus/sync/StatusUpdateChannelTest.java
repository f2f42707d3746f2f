package de.mirkosertic.hgstatus.sync;

import de.mirkosertic.hgstatus.hg.VersionControlException;
import de.mirkosertic.hgstatus.status.StatusStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StatusUpdateChannel Tests")
class StatusUpdateChannelTest {

    private static final Path ROOT = Path.of("/repo").toAbsolutePath();

    private StatusStore store;
    private StatusUpdateChannel channel;
    private AtomicInteger notifications;

    @BeforeEach
    void setUp() {
        store = new StatusStore();
        channel = new StatusUpdateChannel(store, Runnable::run, Runnable::run);
        notifications = new AtomicInteger();
        channel.onStatusChanged(notifications::incrementAndGet);
    }

    @Test
    @DisplayName("Should resolve relative results against the owning root")
    void resolvesAgainstRoot() {
        final Map<Path, Character> result = channel.invoke("query", ROOT, () -> Map.of(Path.of("src/../a.txt"), 'M'));

        assertThat(result).containsExactly(Map.entry(ROOT.resolve("a.txt"), 'M'));
    }

    @Test
    @DisplayName("Should drop relative results without an owning root and keep absolute ones")
    void dropsRelativeWithoutRoot() {
        final Map<Path, Character> answer = new LinkedHashMap<>();
        answer.put(Path.of("a.txt"), 'A');
        answer.put(ROOT.resolve("b.txt"), 'C');

        final Map<Path, Character> result = channel.invoke("query", null, () -> answer);

        assertThat(result).containsExactly(Map.entry(ROOT.resolve("b.txt"), 'C'));
    }

    @Test
    @DisplayName("Should tell a failed call apart from an empty answer")
    void failureIsEmptyOptional() {
        assertThat(channel.tryInvoke("query", ROOT, () -> {
            throw new VersionControlException("abort");
        })).isEmpty();
        assertThat(channel.tryInvoke("query", ROOT, Map::of)).contains(Map.of());
    }

    @Test
    @DisplayName("Should merge a submitted result and notify once")
    void submitMergesAndNotifies() {
        channel.submit("add", ROOT, () -> Map.of(ROOT.resolve("a.txt"), 'A')).join();

        assertThat(store.get(ROOT.resolve("a.txt"))).isPresent();
        assertThat(notifications).hasValue(1);
    }
}
