package io.github.basalt.markdown;

import java.util.Objects;
import java.util.Optional;

/**
 * A single run of text with an optional inline style.
 *
 * @param content the literal text
 * @param style the inline style, empty for plain text
 */
public record TextNode(String content, Optional<Style> style) {
    public TextNode {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(style, "style");
    }

    public static TextNode plain(String content) {
        return new TextNode(content, Optional.empty());
    }

    public static TextNode code(String content) {
        return new TextNode(content, Optional.of(Style.CODE));
    }

    public boolean isCode() {
        return style.filter(s -> s == Style.CODE).isPresent();
    }
}
