package io.github.basalt.markdown.event;

/**
 * Identifies which kind of element a {@link Tag} opens and a {@link MarkdownEvent.End} closes.
 */
public enum TagKind {
    HEADING,
    PARAGRAPH,
    BLOCK_QUOTE,
    CODE_BLOCK,
    LIST,
    ITEM,
    EMPHASIS,
    STRONG,
    STRIKETHROUGH,
    LINK,
    IMAGE,
    HTML_BLOCK,
    TABLE
}
