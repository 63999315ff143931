package de.mirkosertic.termweights.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextCleanerTest {

    @Test
    void shouldReplaceReplacementCharacter() {
        assertThat(TextCleaner.replaceInvalidCharacters("caf\uFFFDe")).isEqualTo("caf e");
    }

    @Test
    void shouldReplaceNullAndControlCharacters() {
        assertThat(TextCleaner.replaceInvalidCharacters("Text\u0000with\u0001\u001Fcontrol"))
                .isEqualTo("Text with  control");
    }

    @Test
    void shouldReplaceZeroWidthCharactersAndByteOrderMark() {
        assertThat(TextCleaner.replaceInvalidCharacters("\uFEFFzero\u200Bwidth\u200C\u200D")).isEqualTo(" zero width  ");
    }

    @Test
    void shouldPreserveWhitespace() {
        final String input = "Line1\nLine2\tTabbed\r\n  spaced";
        assertThat(TextCleaner.replaceInvalidCharacters(input)).isEqualTo(input);
    }

    @Test
    void shouldHandleNullInput() {
        assertThat(TextCleaner.replaceInvalidCharacters(null)).isNull();
    }

    @Test
    void shouldHandleEmptyInput() {
        assertThat(TextCleaner.replaceInvalidCharacters("")).isEmpty();
    }
}
