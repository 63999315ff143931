package de.mirkosertic.termweights;

import de.mirkosertic.termweights.tokenize.FrequencyExporter;
import de.mirkosertic.termweights.tokenize.HtmlTokenExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Tokenization stage: counts the tokens of every HTML file of a directory and writes one
 * frequency file per document plus the combined counts of the corpus.
 * <p>
 * A file that cannot be read, analyzed or written is logged and skipped; only files that
 * were processed contribute to the combined counts.
 */
public class TokenizationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(TokenizationPipeline.class);

    private final HtmlTokenExtractor extractor;
    private final FrequencyExporter exporter;
    private final String htmlSuffix;

    public TokenizationPipeline(final HtmlTokenExtractor extractor,
                                final FrequencyExporter exporter,
                                final String htmlSuffix) {
        this.extractor = extractor;
        this.exporter = exporter;
        this.htmlSuffix = htmlSuffix;
    }

    /**
     * @throws IOException if the import directory cannot be listed or the combined file cannot be written
     */
    public Result run(final Path importDirectory, final Path exportDirectory) throws IOException {
        final Map<String, Integer> combined = new HashMap<>();
        int processed = 0;
        int failed = 0;

        for (final Path file : listHtmlFiles(importDirectory)) {
            final String fileName = file.getFileName().toString();
            final String documentName = fileName.substring(0, fileName.length() - htmlSuffix.length());
            try {
                final Map<String, Integer> counts = extractor.extract(file);
                exporter.export(exportDirectory, documentName, counts);
                counts.forEach((token, count) -> combined.merge(token, count, Integer::sum));
                processed++;
                logger.debug("Tokenized {} into {} distinct tokens", file, counts.size());
            } catch (final IOException | RuntimeException e) {
                failed++;
                logger.error("Failed to process {}", file, e);
            }
        }

        exporter.exportCombined(exportDirectory, combined);

        final Result result = new Result(processed, failed, combined.size());
        logger.info("Tokenized {} HTML files from {} into {} ({} failed, {} distinct tokens)",
                processed, importDirectory, exportDirectory, failed, combined.size());
        return result;
    }

    private List<Path> listHtmlFiles(final Path directory) throws IOException {
        try (final Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(htmlSuffix))
                    .sorted()
                    .toList();
        }
    }

    /**
     * Summary of a tokenization run.
     */
    public record Result(int filesProcessed, int filesFailed, int distinctTokens) {
    }
}
