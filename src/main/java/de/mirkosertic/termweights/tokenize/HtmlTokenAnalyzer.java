package de.mirkosertic.termweights.tokenize;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.charfilter.HTMLStripCharFilter;
import org.apache.lucene.analysis.core.LowerCaseFilter;
import org.apache.lucene.analysis.pattern.PatternReplaceCharFilter;
import org.apache.lucene.analysis.pattern.PatternTokenizer;

import java.io.Reader;
import java.util.regex.Pattern;

/**
 * Analyzer that turns raw HTML into lowercase word tokens.
 * <p>
 * Char filter chain, applied in this order:
 * <ol>
 *   <li>a space is put before every {@code <} and after every {@code >}, so that words on both
 *       sides of a tag never run together</li>
 *   <li>{@link HTMLStripCharFilter} removes tags, comments, scripts and styles and decodes entities</li>
 *   <li>typographic apostrophes (U+2019, U+2018, U+201B, U+02BC, U+02BB) become {@code '}</li>
 *   <li>the possessive {@code 's} is removed from the end of a word</li>
 *   <li>thousands separators between digits are removed ({@code 1,000 -> 1000})</li>
 * </ol>
 * <p>Token chain: {@code PatternTokenizer(split on non-word characters) -> LowerCaseFilter}</p>
 * <p>
 * Word characters are Unicode letters, digits, marks and the underscore. Any other character,
 * including a remaining apostrophe, separates tokens ({@code don't -> don, t}).
 */
public class HtmlTokenAnalyzer extends Analyzer {

    private static final Pattern TAG_OPEN = Pattern.compile("<");
    private static final Pattern TAG_CLOSE = Pattern.compile(">");
    private static final Pattern APOSTROPHE_VARIANTS = Pattern.compile("[\u2019\u2018\u201B\u02BC\u02BB]");
    private static final Pattern POSSESSIVE = Pattern.compile("\\b(\\w+)'s\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern NUMBER_COMMA = Pattern.compile("(?<=\\d),(?=\\d)");
    private static final Pattern NON_WORD = Pattern.compile("\\W+", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    protected Reader initReader(final String fieldName, final Reader reader) {
        Reader filtered = new PatternReplaceCharFilter(TAG_OPEN, " <", reader);
        filtered = new PatternReplaceCharFilter(TAG_CLOSE, "> ", filtered);
        filtered = new HTMLStripCharFilter(filtered);
        filtered = new PatternReplaceCharFilter(APOSTROPHE_VARIANTS, "'", filtered);
        filtered = new PatternReplaceCharFilter(POSSESSIVE, "$1", filtered);
        filtered = new PatternReplaceCharFilter(NUMBER_COMMA, "", filtered);
        return filtered;
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new PatternTokenizer(NON_WORD, -1);
        final TokenStream stream = new LowerCaseFilter(tokenizer);
        return new TokenStreamComponents(tokenizer, stream);
    }
}
