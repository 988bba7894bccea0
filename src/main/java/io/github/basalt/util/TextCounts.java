package io.github.basalt.util;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Character and word counts shown for a note.
 */
public final class TextCounts {
    private static final Pattern MARKDOWN_SYMBOLS = Pattern.compile("[*_`<>?!\\[\\]()=~#+]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextCounts() {
    }

    /**
     * Number of Unicode code points, markup included.
     */
    public static int chars(String text) {
        Objects.requireNonNull(text, "text");
        return text.codePointCount(0, text.length());
    }

    /**
     * Number of whitespace-separated words once Markdown symbols are removed, so a bare
     * {@code #} or {@code - [ ]} does not count as a word but {@code -} does.
     */
    public static int words(String text) {
        Objects.requireNonNull(text, "text");
        var stripped = MARKDOWN_SYMBOLS.matcher(text).replaceAll("");
        return (int) WHITESPACE.splitAsStream(stripped).filter(word -> !word.isEmpty()).count();
    }
}
