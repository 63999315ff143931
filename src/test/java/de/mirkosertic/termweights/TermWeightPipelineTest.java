package de.mirkosertic.termweights;

import de.mirkosertic.termweights.weights.DocumentFrequencyAggregator;
import de.mirkosertic.termweights.weights.FrequencyTableLoader;
import de.mirkosertic.termweights.weights.LineParsePolicy;
import de.mirkosertic.termweights.weights.MalformedLineException;
import de.mirkosertic.termweights.weights.RankedExporter;
import de.mirkosertic.termweights.weights.ScoredDocument;
import de.mirkosertic.termweights.weights.StopwordSet;
import de.mirkosertic.termweights.weights.TfIdfCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("TermWeightPipeline")
class TermWeightPipelineTest {

    @TempDir
    Path tempDir;

    private Path importDir;
    private Path exportDir;

    @BeforeEach
    void setUp() throws IOException {
        importDir = Files.createDirectory(tempDir.resolve("Import"));
        exportDir = Files.createDirectory(tempDir.resolve("Export"));
    }

    private TermWeightPipeline pipeline(final LineParsePolicy policy, final RankedExporter exporter) {
        return new TermWeightPipeline(
                new FrequencyTableLoader(".txt", policy),
                new DocumentFrequencyAggregator(),
                new TfIdfCalculator(),
                exporter);
    }

    @Test
    @DisplayName("Should rank cat above sat after removing stopwords")
    void shouldWeightSingleDocument() throws IOException {
        Files.writeString(importDir.resolve("doc_Sort_by_Frequency.txt"), "the: 5\ncat: 3\nsat: 2\na: 4\n");

        final TermWeightPipeline.Result result = pipeline(LineParsePolicy.LENIENT, new RankedExporter())
                .run(importDir, exportDir, StopwordSet.of("the", "a"));

        assertThat(result.documents()).isEqualTo(1);
        assertThat(result.distinctTokens()).isEqualTo(2);
        assertThat(Files.readString(exportDir.resolve("doc_Sort_by_Term_Weight.wts")))
                .isEqualTo("cat: 0.81311\nsat: 0.58210\n");
    }

    @Test
    @DisplayName("Should write an empty file for a document of stopwords only")
    void shouldWriteEmptyFileForStoplistedDocument() throws IOException {
        Files.writeString(importDir.resolve("doc_Sort_by_Frequency.txt"), "cat:3\nsat:2\n");
        Files.writeString(importDir.resolve("stop_Sort_by_Frequency.txt"), "the:5\na:4\n");

        final TermWeightPipeline.Result result = pipeline(LineParsePolicy.LENIENT, new RankedExporter())
                .run(importDir, exportDir, StopwordSet.of("the", "a"));

        assertThat(result.writtenFiles()).containsExactly(
                exportDir.resolve("doc_Sort_by_Term_Weight.wts"),
                exportDir.resolve("stop_Sort_by_Term_Weight.wts"));
        assertThat(Files.size(exportDir.resolve("stop_Sort_by_Term_Weight.wts"))).isZero();
        // Both tokens share the same idf, which cancels out in the normalization
        assertThat(Files.readString(exportDir.resolve("doc_Sort_by_Term_Weight.wts")))
                .isEqualTo("cat: 0.81311\nsat: 0.58210\n");
    }

    @Test
    @DisplayName("Should ignore a malformed line when parsing leniently")
    void shouldSkipMalformedLine() throws IOException {
        Files.writeString(importDir.resolve("doc.txt"), "cat:3\nbadline\nsat:2\n");

        pipeline(LineParsePolicy.LENIENT, new RankedExporter()).run(importDir, exportDir, StopwordSet.empty());

        assertThat(Files.readString(exportDir.resolve("doc_Sort_by_Term_Weight.wts")))
                .isEqualTo("cat: 0.81311\nsat: 0.58210\n");
    }

    @Test
    @DisplayName("Should abort on a malformed line when parsing strictly, before writing anything")
    void shouldAbortOnMalformedLineWhenStrict() throws IOException {
        Files.writeString(importDir.resolve("a.txt"), "cat:3\n");
        Files.writeString(importDir.resolve("b.txt"), "cat:3\nbadline\n");

        assertThatThrownBy(() -> pipeline(LineParsePolicy.STRICT, new RankedExporter())
                .run(importDir, exportDir, StopwordSet.empty()))
                .isInstanceOf(MalformedLineException.class);

        try (var written = Files.list(exportDir)) {
            assertThat(written).isEmpty();
        }
    }

    @Test
    @DisplayName("Should propagate a failing export")
    void shouldPropagateExportFailure() throws IOException {
        Files.writeString(importDir.resolve("doc.txt"), "cat:3\n");
        final RankedExporter exporter = mock(RankedExporter.class);
        when(exporter.outputFileNames(any())).thenReturn(Map.of("doc.txt", "doc_Sort_by_Term_Weight.wts"));
        when(exporter.export(any(Path.class), any(ScoredDocument.class), anyString()))
                .thenThrow(new IOException("disk full"));

        assertThatThrownBy(() -> pipeline(LineParsePolicy.LENIENT, exporter)
                .run(importDir, exportDir, StopwordSet.empty()))
                .isInstanceOf(IOException.class)
                .hasMessage("disk full");
    }

    @Test
    @DisplayName("Should write one file per document when base names collide")
    void shouldKeepDocumentsWithSharedBaseName() throws IOException {
        Files.writeString(importDir.resolve("news_one.txt"), "cat:3\nsat:2\n");
        Files.writeString(importDir.resolve("news_two.txt"), "dog:1\n");

        final TermWeightPipeline.Result result = pipeline(LineParsePolicy.LENIENT, new RankedExporter())
                .run(importDir, exportDir, StopwordSet.empty());

        assertThat(result.writtenFiles()).containsExactly(
                exportDir.resolve("news_one_Sort_by_Term_Weight.wts"),
                exportDir.resolve("news_two_Sort_by_Term_Weight.wts"));
        try (var written = Files.list(exportDir)) {
            assertThat(written).hasSize(2);
        }
        assertThat(Files.readString(exportDir.resolve("news_one_Sort_by_Term_Weight.wts")))
                .isEqualTo("cat: 0.81311\nsat: 0.58210\n");
        assertThat(Files.readString(exportDir.resolve("news_two_Sort_by_Term_Weight.wts")))
                .isEqualTo("dog: 1.00000\n");
    }

    @Test
    @DisplayName("Should handle an empty import directory")
    void shouldHandleEmptyCorpus() throws IOException {
        final TermWeightPipeline.Result result = pipeline(LineParsePolicy.LENIENT, new RankedExporter())
                .run(importDir, exportDir, StopwordSet.empty());

        assertThat(result.documents()).isZero();
        assertThat(result.writtenFiles()).isEmpty();
    }
}
