package de.mirkosertic.termweights.tokenize;

import de.mirkosertic.termweights.util.TextCleaner;
import de.mirkosertic.termweights.util.TextFiles;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Counts the tokens of HTML documents using {@link HtmlTokenAnalyzer}.
 */
public class HtmlTokenExtractor implements Closeable {

    private static final String FIELD_NAME = "content";

    private final Analyzer analyzer;

    public HtmlTokenExtractor() {
        this(new HtmlTokenAnalyzer());
    }

    HtmlTokenExtractor(final Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Read an HTML file and count its tokens. Bytes that are not valid UTF-8 are dropped.
     */
    public Map<String, Integer> extract(final Path file) throws IOException {
        final String html = TextCleaner.replaceInvalidCharacters(TextFiles.readLenient(file));
        return countTokens(html);
    }

    public Map<String, Integer> countTokens(final String html) throws IOException {
        final Map<String, Integer> counts = new HashMap<>();
        try (final TokenStream tokenStream = analyzer.tokenStream(FIELD_NAME, html)) {
            final CharTermAttribute termAttr = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                counts.merge(termAttr.toString(), 1, Integer::sum);
            }
            tokenStream.end();
        }
        return counts;
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
