package de.mirkosertic.termweights.weights;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Normalized TF-IDF weights of the tokens of one document.
 */
public final class ScoredDocument {

    private final String documentId;
    private final Map<String, Double> weights;

    public ScoredDocument(final String documentId, final Map<String, Double> weights) {
        this.documentId = documentId;
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public String getDocumentId() {
        return documentId;
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public double weight(final String token) {
        final Double weight = weights.get(token);
        if (weight == null) {
            throw new IllegalArgumentException("Token '" + token + "' is not part of document " + documentId);
        }
        return weight;
    }

    public Set<String> tokens() {
        return weights.keySet();
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    /**
     * Euclidean length of the weight vector; 1.0 for a normalized document with at least one
     * nonzero score.
     */
    public double norm() {
        double sumOfSquares = 0;
        for (final double weight : weights.values()) {
            sumOfSquares += weight * weight;
        }
        return Math.sqrt(sumOfSquares);
    }

    @Override
    public String toString() {
        return "ScoredDocument{" + documentId + ", " + weights.size() + " tokens}";
    }
}
