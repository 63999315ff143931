package de.mirkosertic.termweights.weights;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes L2-normalized TF-IDF weights per document.
 * <p>
 * For a token with count {@code c} in a document of {@code n} counted terms, and a document
 * frequency {@code df} in a corpus of {@code N} documents:
 * <pre>
 *   tf  = ln(1 + c / n)
 *   idf = ln(N / df) + 1    if df == N
 *   idf = ln(N / df)        otherwise
 * </pre>
 * Tokens shared by every document (which includes every token of a single-document corpus)
 * therefore keep their term frequency signal instead of scoring zero. The scores of a document
 * are then divided by their Euclidean norm.
 * <p>
 * A document whose scores are all zero cannot be normalized; all its weights are set to
 * {@code 0.0}.
 */
public class TfIdfCalculator {

    private static final Logger logger = LoggerFactory.getLogger(TfIdfCalculator.class);

    /**
     * Score every document of the table.
     *
     * @param table          token counts per document
     * @param df             document frequencies aggregated over the same corpus
     * @param totalDocuments number of documents in the corpus
     * @return scored documents keyed by document identifier, in table order
     * @throws IllegalArgumentException if a token has no document frequency within {@code [1, totalDocuments]}
     */
    public Map<String, ScoredDocument> compute(final DocumentFrequencyTable table,
                                               final CorpusDocumentFrequency df,
                                               final int totalDocuments) {
        final Map<String, ScoredDocument> result = new LinkedHashMap<>();
        for (final Map.Entry<String, Map<String, Long>> entry : table.asMap().entrySet()) {
            result.put(entry.getKey(), score(entry.getKey(), entry.getValue(), df, totalDocuments));
        }
        return result;
    }

    ScoredDocument score(final String documentId,
                         final Map<String, Long> counts,
                         final CorpusDocumentFrequency df,
                         final int totalDocuments) {
        if (counts.isEmpty()) {
            return new ScoredDocument(documentId, Map.of());
        }

        long totalTerms = 0;
        for (final long count : counts.values()) {
            totalTerms += count;
        }

        final Map<String, Double> scores = new LinkedHashMap<>();
        double sumOfSquares = 0;
        for (final Map.Entry<String, Long> entry : counts.entrySet()) {
            final String token = entry.getKey();
            final double tf = termFrequency(entry.getValue(), totalTerms);
            final double idf = inverseDocumentFrequency(documentFrequencyOf(token, df, totalDocuments), totalDocuments);
            final double score = tf * idf;
            scores.put(token, score);
            sumOfSquares += score * score;
        }

        final double norm = Math.sqrt(sumOfSquares);
        final Map<String, Double> weights = new LinkedHashMap<>();
        if (norm == 0 || !Double.isFinite(norm)) {
            logger.warn("Document {} has no nonzero score (norm={}), all {} weights set to 0",
                    documentId, norm, scores.size());
            for (final String token : scores.keySet()) {
                weights.put(token, 0.0);
            }
        } else {
            for (final Map.Entry<String, Double> entry : scores.entrySet()) {
                weights.put(entry.getKey(), entry.getValue() / norm);
            }
        }
        return new ScoredDocument(documentId, weights);
    }

    /**
     * Dampened term frequency {@code ln(1 + count / totalTerms)}, in {@code [0, ln 2]}.
     * A document without counted terms has a term frequency of zero for every token.
     */
    static double termFrequency(final long count, final long totalTerms) {
        if (totalTerms <= 0) {
            return 0;
        }
        return Math.log(1 + (double) count / totalTerms);
    }

    static double inverseDocumentFrequency(final int documentFrequency, final int totalDocuments) {
        final double idf = Math.log((double) totalDocuments / documentFrequency);
        if (documentFrequency == totalDocuments) {
            return idf + 1;
        }
        return idf;
    }

    private static int documentFrequencyOf(final String token,
                                           final CorpusDocumentFrequency df,
                                           final int totalDocuments) {
        final int documentFrequency = df.get(token);
        if (documentFrequency < 1 || documentFrequency > totalDocuments) {
            throw new IllegalArgumentException("Document frequency " + documentFrequency + " of token '" + token
                    + "' is outside [1, " + totalDocuments + "]");
        }
        return documentFrequency;
    }
}
