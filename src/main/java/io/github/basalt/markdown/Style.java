package io.github.basalt.markdown;

/**
 * Inline style of a {@link TextNode}. Only code spans are tracked for now; emphasis,
 * strong and strikethrough text is kept as plain runs.
 */
public enum Style {
    CODE
}
