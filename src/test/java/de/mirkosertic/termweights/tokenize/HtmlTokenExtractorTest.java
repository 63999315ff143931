package de.mirkosertic.termweights.tokenize;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@DisplayName("HtmlTokenExtractor")
class HtmlTokenExtractorTest {

    @TempDir
    Path tempDir;

    private HtmlTokenExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new HtmlTokenExtractor();
    }

    @AfterEach
    void tearDown() {
        extractor.close();
    }

    @Test
    @DisplayName("Should count every occurrence of a token")
    void shouldCountOccurrences() throws IOException {
        final Map<String, Integer> counts = extractor.countTokens("<p>The cat and the hat</p><p>the end</p>");

        assertThat(counts).containsOnly(
                entry("the", 3), entry("cat", 1), entry("and", 1), entry("hat", 1), entry("end", 1));
    }

    @Test
    @DisplayName("Should drop invalid UTF-8 bytes")
    void shouldIgnoreUndecodableContent() throws IOException {
        final Path file = tempDir.resolve("page.html");
        final byte[] prefix = "<p>ca".getBytes(StandardCharsets.UTF_8);
        final byte[] suffix = "t dog</p>".getBytes(StandardCharsets.UTF_8);
        final byte[] content = new byte[prefix.length + 1 + suffix.length];
        System.arraycopy(prefix, 0, content, 0, prefix.length);
        content[prefix.length] = (byte) 0xC3;
        System.arraycopy(suffix, 0, content, prefix.length + 1, suffix.length);
        Files.write(file, content);

        assertThat(extractor.extract(file)).containsOnly(entry("cat", 1), entry("dog", 1));
    }

    @Test
    @DisplayName("Should split words at control, zero-width and replacement characters")
    void shouldSplitAtInvalidCharacters() throws IOException {
        final Path file = tempDir.resolve("page.html");
        Files.writeString(file, "<p>cat\u0001dog fish\u001Fbird</p><p>sun\u200Bmoon\uFFFDstar</p>");

        assertThat(extractor.extract(file)).containsOnly(
                entry("cat", 1), entry("dog", 1), entry("fish", 1), entry("bird", 1),
                entry("sun", 1), entry("moon", 1), entry("star", 1));
    }

    @Test
    @DisplayName("Should fail for a missing file")
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> extractor.extract(tempDir.resolve("missing.html")))
                .isInstanceOf(NoSuchFileException.class);
    }
}
