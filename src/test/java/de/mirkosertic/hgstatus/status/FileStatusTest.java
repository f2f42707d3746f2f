package de.mirkosertic.hgstatus.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FileStatus Tests")
class FileStatusTest {

    @ParameterizedTest(name = "''{0}'' -> {1}")
    @CsvSource({
            "C, CONTROLLED",
            "M, MODIFIED",
            "A, ADDED",
            "R, REMOVED",
            "I, IGNORED",
            "N, RENAMED",
            "?, UNCONTROLLED",
            "X, UNCONTROLLED"
    })
    @DisplayName("Should map status characters")
    void shouldMapStatusCharacters(final char statusChar, final FileStatus expected) {
        assertThat(FileStatus.fromStatusChar(statusChar)).isEqualTo(expected);
    }
}
