package de.mirkosertic.termweights.weights;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Token counts of every document of a corpus, keyed by document identifier.
 * <p>
 * Documents are kept in identifier order and neither the outer nor the per-document maps can
 * be modified once the table is built.
 */
public final class DocumentFrequencyTable {

    private final Map<String, Map<String, Long>> documents;

    public DocumentFrequencyTable(final Map<String, ? extends Map<String, Long>> documents) {
        final Map<String, Map<String, Long>> sorted = new TreeMap<>();
        for (final Map.Entry<String, ? extends Map<String, Long>> entry : documents.entrySet()) {
            for (final Map.Entry<String, Long> count : entry.getValue().entrySet()) {
                if (count.getValue() == null || count.getValue() < 0) {
                    throw new IllegalArgumentException("Invalid count " + count.getValue() + " for token '"
                            + count.getKey() + "' in document " + entry.getKey());
                }
            }
            sorted.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
        }
        this.documents = Collections.unmodifiableMap(new LinkedHashMap<>(sorted));
    }

    public Set<String> documentIds() {
        return documents.keySet();
    }

    /**
     * @return the token counts of the document, or an empty map for an unknown identifier
     */
    public Map<String, Long> counts(final String documentId) {
        return documents.getOrDefault(documentId, Map.of());
    }

    public Map<String, Map<String, Long>> asMap() {
        return documents;
    }

    public int documentCount() {
        return documents.size();
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }
}
