package de.mirkosertic.termweights.weights;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the weights of a {@link ScoredDocument} highest first, one {@code token: weight} line
 * per token with five decimals.
 * <p>
 * Equal weights are ordered by token in ascending {@link String#compareTo} order.
 */
public class RankedExporter {

    private static final Logger logger = LoggerFactory.getLogger(RankedExporter.class);

    public static final String DEFAULT_EXTENSION = "wts";

    static final String FILE_NAME_INFIX = "_Sort_by_Term_Weight.";

    private static final Comparator<WeightedTerm> RANKING = Comparator
            .comparingDouble(WeightedTerm::weight).reversed()
            .thenComparing(WeightedTerm::token);

    private final String extension;
    private final String inputSuffix;

    public RankedExporter() {
        this(DEFAULT_EXTENSION, FrequencyTableLoader.DEFAULT_SUFFIX);
    }

    /**
     * @param extension   extension of the written files, without the dot
     * @param inputSuffix suffix of the frequency files, removed from identifiers without an underscore
     */
    public RankedExporter(final String extension, final String inputSuffix) {
        this.extension = extension;
        this.inputSuffix = inputSuffix;
    }

    public List<WeightedTerm> rank(final ScoredDocument scored) {
        final List<WeightedTerm> ranked = new ArrayList<>(scored.getWeights().size());
        for (final Map.Entry<String, Double> entry : scored.getWeights().entrySet()) {
            ranked.add(new WeightedTerm(entry.getKey(), entry.getValue()));
        }
        ranked.sort(RANKING);
        return ranked;
    }

    public String format(final List<WeightedTerm> ranked) {
        final StringBuilder result = new StringBuilder();
        for (final WeightedTerm term : ranked) {
            result.append(formatLine(term));
        }
        return result.toString();
    }

    static String formatLine(final WeightedTerm term) {
        return term.token() + ": " + String.format(Locale.ROOT, "%.5f", term.weight()) + "\n";
    }

    /**
     * Write the ranked weights of a document into the export directory.
     *
     * @return the written file
     */
    public Path export(final Path exportDirectory, final ScoredDocument scored) throws IOException {
        return export(exportDirectory, scored, outputFileName(scored.getDocumentId()));
    }

    /**
     * Write the ranked weights of a document into the named file of the export directory.
     *
     * @return the written file
     */
    public Path export(final Path exportDirectory, final ScoredDocument scored, final String fileName)
            throws IOException {
        final Path target = exportDirectory.resolve(fileName);
        final List<WeightedTerm> ranked = rank(scored);
        try (final Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (final WeightedTerm term : ranked) {
                writer.write(formatLine(term));
            }
        }
        logger.debug("Wrote {} weights to {}", ranked.size(), target);
        return target;
    }

    /**
     * {@code <base-name>_Sort_by_Term_Weight.<extension>}, where the base name is the document
     * identifier up to its first underscore, or the identifier without the input suffix if it
     * has none.
     */
    public String outputFileName(final String documentId) {
        return baseName(documentId) + FILE_NAME_INFIX + extension;
    }

    /**
     * Output file names for a whole corpus, keyed by document identifier.
     * <p>
     * Documents whose base names collide, such as {@code news_one.txt} and {@code news_two.txt},
     * are named after their full identifier without the input suffix instead, so every document
     * keeps its own file.
     */
    public Map<String, String> outputFileNames(final Collection<String> documentIds) {
        final Map<String, List<String>> byBaseName = new HashMap<>();
        for (final String documentId : documentIds) {
            byBaseName.computeIfAbsent(baseName(documentId), key -> new ArrayList<>()).add(documentId);
        }

        final Map<String, String> names = new LinkedHashMap<>();
        for (final String documentId : documentIds) {
            final List<String> sharing = byBaseName.get(baseName(documentId));
            if (sharing.size() > 1) {
                names.put(documentId, withoutInputSuffix(documentId) + FILE_NAME_INFIX + extension);
            } else {
                names.put(documentId, outputFileName(documentId));
            }
        }
        byBaseName.forEach((baseName, sharing) -> {
            if (sharing.size() > 1) {
                logger.warn("Documents {} share the base name '{}', naming their files after the full identifier",
                        sharing, baseName);
            }
        });
        return names;
    }

    String baseName(final String documentId) {
        final int underscore = documentId.indexOf('_');
        if (underscore >= 0) {
            return documentId.substring(0, underscore);
        }
        return withoutInputSuffix(documentId);
    }

    private String withoutInputSuffix(final String documentId) {
        if (!inputSuffix.isEmpty() && documentId.endsWith(inputSuffix)) {
            return documentId.substring(0, documentId.length() - inputSuffix.length());
        }
        return documentId;
    }
}
