package io.github.basalt.markdown.event;

import io.github.basalt.markdown.SourceRange;

/**
 * A lexical event paired with the byte range of source text it corresponds to.
 * <p>
 * A {@link Start} and its matching {@link End} both carry the range of the whole element.
 */
public sealed interface MarkdownEvent {

    SourceRange range();

    record Start(Tag tag, SourceRange range) implements MarkdownEvent {}

    record End(TagKind kind, SourceRange range) implements MarkdownEvent {}

    record Text(String text, SourceRange range) implements MarkdownEvent {}

    /** An inline code span, without its backtick delimiters. */
    record Code(String code, SourceRange range) implements MarkdownEvent {}

    /** Emitted right after the {@link Start} of a list item that carries a checkbox. */
    record TaskListMarker(boolean checked, SourceRange range) implements MarkdownEvent {}

    record SoftBreak(SourceRange range) implements MarkdownEvent {}

    record HardBreak(SourceRange range) implements MarkdownEvent {}

    record Rule(SourceRange range) implements MarkdownEvent {}

    record Html(String html, SourceRange range) implements MarkdownEvent {}

    record InlineHtml(String html, SourceRange range) implements MarkdownEvent {}
}
