package de.mirkosertic.termweights.tokenize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Writes token counts as {@code token: count} lines, most frequent first and alphabetically
 * among equal counts. The output is the input format of the weighting stage.
 */
public class FrequencyExporter {

    private static final Logger logger = LoggerFactory.getLogger(FrequencyExporter.class);

    static final String FILE_NAME_SUFFIX = "_Sort_by_Frequency.txt";
    static final String COMBINED_FILE_NAME = "Combined" + FILE_NAME_SUFFIX;

    private static final Comparator<Map.Entry<String, Integer>> BY_COUNT_THEN_TOKEN =
            Map.Entry.<String, Integer>comparingByValue().reversed()
                    .thenComparing(Map.Entry.comparingByKey());

    public List<Map.Entry<String, Integer>> sortByCount(final Map<String, Integer> counts) {
        final List<Map.Entry<String, Integer>> sorted = new ArrayList<>(counts.entrySet());
        sorted.sort(BY_COUNT_THEN_TOKEN);
        return sorted;
    }

    /**
     * Write the counts of one document to {@code <documentName>_Sort_by_Frequency.txt}.
     */
    public Path export(final Path exportDirectory, final String documentName, final Map<String, Integer> counts)
            throws IOException {
        return write(exportDirectory.resolve(documentName + FILE_NAME_SUFFIX), counts);
    }

    public Path exportCombined(final Path exportDirectory, final Map<String, Integer> counts) throws IOException {
        return write(exportDirectory.resolve(COMBINED_FILE_NAME), counts);
    }

    private Path write(final Path target, final Map<String, Integer> counts) throws IOException {
        try (final Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (final Map.Entry<String, Integer> entry : sortByCount(counts)) {
                writer.write(entry.getKey() + ": " + entry.getValue() + "\n");
            }
        }
        logger.debug("Wrote {} token counts to {}", counts.size(), target);
        return target;
    }
}
