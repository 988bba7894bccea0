package io.github.basalt.markdown;

/**
 * Callout variants of a block quote, written as {@code > [!NOTE]} on the first quoted line.
 */
public enum BlockQuoteKind {
    NOTE,
    TIP,
    IMPORTANT,
    WARNING,
    CAUTION
}
