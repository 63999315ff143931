package de.mirkosertic.termweights.weights;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Computes corpus-wide document frequencies. A token contributes one to its counter per
 * document that contains it, however often it occurs there.
 */
public class DocumentFrequencyAggregator {

    private static final Logger logger = LoggerFactory.getLogger(DocumentFrequencyAggregator.class);

    public CorpusDocumentFrequency aggregate(final DocumentFrequencyTable table) {
        final Map<String, Integer> counters = new HashMap<>();
        for (final Map<String, Long> counts : table.asMap().values()) {
            for (final String token : counts.keySet()) {
                counters.merge(token, 1, Integer::sum);
            }
        }
        logger.debug("Aggregated document frequencies for {} tokens over {} documents",
                counters.size(), table.documentCount());
        return new CorpusDocumentFrequency(counters);
    }
}
