package de.mirkosertic.termweights.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads UTF-8 text files while dropping byte sequences that are not valid UTF-8, so a single
 * broken byte never fails a whole document.
 */
public final class TextFiles {

    private static final int BUFFER_SIZE = 8192;

    private TextFiles() {
        // Utility class, no instances
    }

    public static BufferedReader newLenientReader(final Path file) throws IOException {
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        return new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder));
    }

    public static String readLenient(final Path file) throws IOException {
        final StringBuilder content = new StringBuilder();
        try (final BufferedReader reader = newLenientReader(file)) {
            final char[] buffer = new char[BUFFER_SIZE];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                content.append(buffer, 0, read);
            }
        }
        return content.toString();
    }
}
