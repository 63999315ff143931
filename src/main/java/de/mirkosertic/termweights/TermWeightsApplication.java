package de.mirkosertic.termweights;

import de.mirkosertic.termweights.config.ApplicationConfig;
import de.mirkosertic.termweights.config.ConfigurationException;
import de.mirkosertic.termweights.config.LoggingConfigurator;
import de.mirkosertic.termweights.tokenize.FrequencyExporter;
import de.mirkosertic.termweights.tokenize.HtmlTokenExtractor;
import de.mirkosertic.termweights.weights.DocumentFrequencyAggregator;
import de.mirkosertic.termweights.weights.FrequencyTableLoader;
import de.mirkosertic.termweights.weights.RankedExporter;
import de.mirkosertic.termweights.weights.StopwordSet;
import de.mirkosertic.termweights.weights.TfIdfCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Main entry point. Runs either the tokenization stage or the weighting stage with the
 * directories from {@link ApplicationConfig}.
 */
public class TermWeightsApplication {

    private static final Logger logger = LoggerFactory.getLogger(TermWeightsApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ApplicationConfig config;

    public TermWeightsApplication(final ApplicationConfig config) {
        this.config = config;
    }

    /**
     * Run one stage.
     *
     * @throws ConfigurationException if a required input is missing or the export directory cannot be created
     * @throws IOException            if a document cannot be processed
     */
    public void run(final RunMode mode) throws ConfigurationException, IOException {
        config.validate();
        final Path importDir = requireDirectory(config.getImportDir());
        final Path exportDir = config.getExportDir();

        switch (mode) {
            case TOKENIZE -> {
                ensureExportDirectory(exportDir);
                runTokenization(importDir, exportDir);
            }
            case WEIGHTS -> {
                final Path stoplist = requireStoplist(config.getStoplist());
                ensureExportDirectory(exportDir);
                runWeighting(importDir, exportDir, stoplist);
            }
        }
    }

    private void runTokenization(final Path importDir, final Path exportDir) throws IOException {
        try (final HtmlTokenExtractor extractor = new HtmlTokenExtractor()) {
            final TokenizationPipeline pipeline = new TokenizationPipeline(
                    extractor,
                    new FrequencyExporter(),
                    config.getHtmlSuffix()
            );
            pipeline.run(importDir, exportDir);
        }
        logger.info("HTML files from {} are now tokenized and exported to {}", importDir, exportDir);
    }

    private void runWeighting(final Path importDir, final Path exportDir, final Path stoplist) throws IOException {
        final StopwordSet stopwords = StopwordSet.load(stoplist);
        final TermWeightPipeline pipeline = new TermWeightPipeline(
                new FrequencyTableLoader(config.getFrequencySuffix(), config.getLineParsePolicy()),
                new DocumentFrequencyAggregator(),
                new TfIdfCalculator(),
                new RankedExporter(config.getWeightsExtension(), config.getFrequencySuffix())
        );
        pipeline.run(importDir, exportDir, stopwords);
        logger.info("Frequency files from {} are now weighted and exported to {}", importDir, exportDir);
    }

    private static Path requireDirectory(final Path importDir) throws ConfigurationException {
        if (!Files.isDirectory(importDir)) {
            throw new ConfigurationException("Import directory " + importDir + " does not exist");
        }
        return importDir;
    }

    private static Path requireStoplist(final Path stoplist) throws ConfigurationException {
        if (!Files.isRegularFile(stoplist)) {
            throw new ConfigurationException("Stoplist file " + stoplist + " does not exist");
        }
        return stoplist;
    }

    private static void ensureExportDirectory(final Path exportDir) throws ConfigurationException {
        if (Files.isDirectory(exportDir)) {
            return;
        }
        try {
            Files.createDirectories(exportDir);
            logger.info("New directory {} is now created", exportDir);
        } catch (final IOException e) {
            throw new ConfigurationException("Export directory " + exportDir + " cannot be created", e);
        }
    }

    /**
     * Run the application and map failures to a process exit status.
     */
    static int execute(final String[] args, final ApplicationConfig config) {
        try {
            final RunMode mode = RunMode.fromArguments(args);
            new TermWeightsApplication(config).run(mode);
            return EXIT_OK;
        } catch (final ConfigurationException e) {
            logger.error("Configuration error: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (final IOException e) {
            logger.error("Run aborted: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    public static void main(final String[] args) {
        // Configure logging FIRST, before any other code that might log
        LoggingConfigurator.configure(ApplicationConfig.isBatchProfile());

        final ApplicationConfig config = ApplicationConfig.load();
        final int status = execute(args, config);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }
}
