package de.mirkosertic.termweights.weights;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised under {@link LineParsePolicy#STRICT} for a frequency file line that is not a
 * {@code token:count} pair with a non-negative integer count.
 */
public class MalformedLineException extends IOException {

    private final Path file;
    private final int lineNumber;
    private final String line;

    public MalformedLineException(final Path file, final int lineNumber, final String line, final String reason) {
        super("Malformed line " + lineNumber + " in " + file + " (" + reason + "): '" + line + "'");
        this.file = file;
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public Path getFile() {
        return file;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
