package de.mirkosertic.termweights.weights;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Number of documents each token occurs in at least once.
 */
public final class CorpusDocumentFrequency {

    private final Map<String, Integer> frequencies;

    public CorpusDocumentFrequency(final Map<String, Integer> frequencies) {
        this.frequencies = Collections.unmodifiableMap(new TreeMap<>(frequencies));
    }

    /**
     * @return the document frequency of the token, 0 if no document contains it
     */
    public int get(final String token) {
        return frequencies.getOrDefault(token, 0);
    }

    public boolean contains(final String token) {
        return frequencies.containsKey(token);
    }

    public int vocabularySize() {
        return frequencies.size();
    }

    public Map<String, Integer> asMap() {
        return frequencies;
    }
}
