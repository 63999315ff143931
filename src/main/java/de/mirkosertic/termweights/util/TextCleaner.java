package de.mirkosertic.termweights.util;

import java.util.regex.Pattern;

/**
 * Turns characters that carry no text into spaces, so they still separate the words around them.
 *
 * <p>Replaced characters:</p>
 * <ul>
 *   <li>U+FFFD replacement characters left behind by failed decoding</li>
 *   <li>U+0000 and the control characters other than tab, line feed and carriage return</li>
 *   <li>zero-width space, non-joiner and joiner (U+200B to U+200D)</li>
 *   <li>U+FEFF byte order marks</li>
 * </ul>
 * Whitespace is left untouched, since it separates tokens later on.
 */
public final class TextCleaner {

    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\\x00-\\x08" +               // NULL and control chars before TAB
        "\\x0B\\x0C" +                // VT and FF
        "\\x0E-\\x1F" +               // Control chars after CR
        "\\u200B-\\u200D" +           // Zero-width space, non-joiner, joiner
        "\\uFEFF" +                   // Byte order mark
        "\\uFFFD" +                   // Replacement character
        "]"
    );

    private TextCleaner() {
        // Utility class, no instances
    }

    /**
     * @param text the text to clean (may be null)
     * @return the text with every invalid character replaced by a space, or null if input was null
     */
    public static String replaceInvalidCharacters(final String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return INVALID_CHARS.matcher(text).replaceAll(" ");
    }
}
