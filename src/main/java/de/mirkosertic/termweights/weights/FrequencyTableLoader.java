package de.mirkosertic.termweights.weights;

import de.mirkosertic.termweights.util.TextFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads the {@code token:count} files of a directory into a {@link DocumentFrequencyTable}.
 * <p>
 * Each file becomes one document, identified by its file name. Stopwords and tokens shorter
 * than two characters are dropped; a token listed on several lines has its counts summed.
 * Lines that are not a valid pair are handled according to the {@link LineParsePolicy}.
 */
public class FrequencyTableLoader {

    private static final Logger logger = LoggerFactory.getLogger(FrequencyTableLoader.class);

    public static final String DEFAULT_SUFFIX = ".txt";

    private final String suffix;
    private final LineParsePolicy policy;

    public FrequencyTableLoader() {
        this(DEFAULT_SUFFIX, LineParsePolicy.LENIENT);
    }

    public FrequencyTableLoader(final String suffix, final LineParsePolicy policy) {
        this.suffix = suffix;
        this.policy = policy;
    }

    /**
     * Load every frequency file of the directory.
     *
     * @throws IOException if the directory or one of its files cannot be read, or a line is
     *                     malformed under {@link LineParsePolicy#STRICT}
     */
    public DocumentFrequencyTable load(final Path directory, final StopwordSet stopwords) throws IOException {
        final Map<String, Map<String, Long>> documents = new LinkedHashMap<>();
        for (final Path file : listFrequencyFiles(directory)) {
            final Map<String, Long> counts = loadFile(file, stopwords);
            documents.put(file.getFileName().toString(), counts);
            logger.debug("Loaded {} tokens from {}", counts.size(), file);
        }
        logger.info("Loaded {} frequency files from {}", documents.size(), directory);
        return new DocumentFrequencyTable(documents);
    }

    List<Path> listFrequencyFiles(final Path directory) throws IOException {
        try (final Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(suffix))
                    .sorted()
                    .toList();
        }
    }

    Map<String, Long> loadFile(final Path file, final StopwordSet stopwords) throws IOException {
        final List<String> lines = new ArrayList<>();
        try (final BufferedReader reader = TextFiles.newLenientReader(file)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        }
        return parse(file, lines, stopwords);
    }

    /**
     * Parse the lines of one frequency file.
     * <p>
     * A count that would push the total of the document beyond {@link Long#MAX_VALUE} is
     * treated like any other invalid count.
     *
     * @param file only used in log and error messages
     */
    Map<String, Long> parse(final Path file, final List<String> lines, final StopwordSet stopwords)
            throws MalformedLineException {
        final Map<String, Long> counts = new LinkedHashMap<>();
        long totalTerms = 0;
        int lineNumber = 0;
        for (final String line : lines) {
            lineNumber++;
            final String[] parts = line.strip().split(":", -1);
            if (parts.length != 2) {
                if (policy == LineParsePolicy.STRICT) {
                    throw new MalformedLineException(file, lineNumber, line, "expected token:count");
                }
                continue;
            }

            final String token = parts[0].strip();
            final String value = parts[1].strip();
            final long count;
            try {
                count = Long.parseLong(value);
            } catch (final NumberFormatException e) {
                rejectCount(file, lineNumber, line, isDigits(value) ? "count is too large" : "count is not an integer");
                continue;
            }
            if (count < 0) {
                rejectCount(file, lineNumber, line, "count is negative");
                continue;
            }

            if (!stopwords.contains(token) && isLongEnough(token)) {
                if (count > Long.MAX_VALUE - totalTerms) {
                    rejectCount(file, lineNumber, line, "count overflows the document total");
                    continue;
                }
                totalTerms += count;
                counts.merge(token, count, Long::sum);
            }
        }
        return counts;
    }

    private void rejectCount(final Path file, final int lineNumber, final String line, final String reason)
            throws MalformedLineException {
        if (policy == LineParsePolicy.STRICT) {
            throw new MalformedLineException(file, lineNumber, line, reason);
        }
        logger.warn("Skipping line {} of {}: {} ('{}')", lineNumber, file, reason, line);
    }

    private static boolean isDigits(final String value) {
        return !value.isEmpty() && value.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    private static boolean isLongEnough(final String token) {
        return token.codePointCount(0, token.length()) > 1;
    }

    public String getSuffix() {
        return suffix;
    }

    public LineParsePolicy getPolicy() {
        return policy;
    }
}
