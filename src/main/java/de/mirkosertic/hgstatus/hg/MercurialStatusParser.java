package de.mirkosertic.hgstatus.hg;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the output of {@code hg status -A -C}.
 * <p>
 * Each file is printed as {@code "X path"} with X the status code. With {@code -C} an
 * added file that was copied or renamed is followed by a line indented by two spaces
 * naming its source; such an entry is reported as {@code 'N'} (renamed).
 * Missing files ({@code '!'}) are still tracked and reported as {@code 'M'}.
 */
public final class MercurialStatusParser {

    private static final Logger logger = LoggerFactory.getLogger(MercurialStatusParser.class);

    private static final String COPY_SOURCE_PREFIX = "  ";

    private MercurialStatusParser() {
    }

    /**
     * @param output      raw tool output
     * @param baseDirectory directory the printed paths are relative to
     * @return absolute path to status character, in output order
     */
    public static Map<Path, Character> parse(final String output, final Path baseDirectory) {
        final Map<Path, Character> result = new LinkedHashMap<>();
        Path lastAdded = null;

        for (final String rawLine : output.split("\\R")) {
            if (rawLine.isBlank()) {
                continue;
            }
            if (rawLine.startsWith(COPY_SOURCE_PREFIX)) {
                if (lastAdded != null) {
                    result.put(lastAdded, 'N');
                    lastAdded = null;
                }
                continue;
            }
            if (rawLine.length() < 3 || rawLine.charAt(1) != ' ') {
                logger.debug("Ignoring malformed status line: {}", rawLine);
                continue;
            }

            final char code = rawLine.charAt(0);
            final Path path = baseDirectory.resolve(rawLine.substring(2)).normalize();
            switch (code) {
                case 'C', 'M', 'A', 'R', 'I', '?' -> result.put(path, code);
                case '!' -> result.put(path, 'M');
                default -> {
                    logger.debug("Ignoring unknown status code '{}' for {}", code, path);
                    lastAdded = null;
                    continue;
                }
            }
            lastAdded = code == 'A' ? path : null;
        }
        return result;
    }
}
