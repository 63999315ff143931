package de.mirkosertic.termweights;

import de.mirkosertic.termweights.weights.CorpusDocumentFrequency;
import de.mirkosertic.termweights.weights.DocumentFrequencyAggregator;
import de.mirkosertic.termweights.weights.DocumentFrequencyTable;
import de.mirkosertic.termweights.weights.FrequencyTableLoader;
import de.mirkosertic.termweights.weights.RankedExporter;
import de.mirkosertic.termweights.weights.ScoredDocument;
import de.mirkosertic.termweights.weights.StopwordSet;
import de.mirkosertic.termweights.weights.TfIdfCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Weighting stage: loads the frequency files of a directory, scores every token with
 * normalized TF-IDF and writes one ranked weight file per document.
 * <p>
 * The whole corpus is loaded and aggregated before the first score is computed. Any
 * {@link IOException} aborts the run.
 */
public class TermWeightPipeline {

    private static final Logger logger = LoggerFactory.getLogger(TermWeightPipeline.class);

    private final FrequencyTableLoader loader;
    private final DocumentFrequencyAggregator aggregator;
    private final TfIdfCalculator calculator;
    private final RankedExporter exporter;

    public TermWeightPipeline(final FrequencyTableLoader loader,
                              final DocumentFrequencyAggregator aggregator,
                              final TfIdfCalculator calculator,
                              final RankedExporter exporter) {
        this.loader = loader;
        this.aggregator = aggregator;
        this.calculator = calculator;
        this.exporter = exporter;
    }

    public Result run(final Path importDirectory, final Path exportDirectory, final StopwordSet stopwords)
            throws IOException {
        final DocumentFrequencyTable table = loader.load(importDirectory, stopwords);
        final CorpusDocumentFrequency documentFrequencies = aggregator.aggregate(table);
        final Map<String, ScoredDocument> scored = calculator.compute(table, documentFrequencies, table.documentCount());

        final Map<String, String> fileNames = exporter.outputFileNames(scored.keySet());
        final List<Path> written = new ArrayList<>(scored.size());
        for (final ScoredDocument document : scored.values()) {
            written.add(exporter.export(exportDirectory, document, fileNames.get(document.getDocumentId())));
        }

        final Result result = new Result(table.documentCount(), documentFrequencies.vocabularySize(), written);
        logger.info("Weighted {} documents with {} distinct tokens into {}",
                result.documents(), result.distinctTokens(), exportDirectory);
        return result;
    }

    /**
     * Summary of a weighting run.
     */
    public record Result(int documents, int distinctTokens, List<Path> writtenFiles) {
    }
}
