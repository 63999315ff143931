package de.mirkosertic.termweights.weights;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Set of tokens that are excluded from weighting regardless of their frequency.
 * <p>
 * Words are taken verbatim from the stoplist file; no case folding is applied, so the
 * stoplist has to follow the same case convention as the frequency files.
 */
public final class StopwordSet {

    private static final Logger logger = LoggerFactory.getLogger(StopwordSet.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final StopwordSet EMPTY = new StopwordSet(Set.of());

    private final Set<String> words;

    private StopwordSet(final Set<String> words) {
        this.words = words;
    }

    /**
     * Read a whitespace separated word list.
     *
     * @param path the stoplist file
     * @return the loaded stopwords
     * @throws IOException if the file cannot be read
     */
    public static StopwordSet load(final Path path) throws IOException {
        final String content = Files.readString(path, StandardCharsets.UTF_8);
        final StopwordSet stopwords = parse(content);
        logger.debug("Loaded {} stopwords from {}", stopwords.size(), path);
        return stopwords;
    }

    public static StopwordSet parse(final String content) {
        final Set<String> words = new HashSet<>();
        for (final String word : WHITESPACE.split(content)) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return new StopwordSet(Set.copyOf(words));
    }

    public static StopwordSet of(final String... words) {
        return new StopwordSet(Set.copyOf(Arrays.asList(words)));
    }

    public static StopwordSet empty() {
        return EMPTY;
    }

    public boolean contains(final String token) {
        return words.contains(token);
    }

    public int size() {
        return words.size();
    }

    public Set<String> asSet() {
        return words;
    }
}
