package io.github.basalt.markdown.event;

import java.util.List;

/**
 * Turns Markdown source text into a flat, ordered stream of {@link MarkdownEvent}s.
 */
public interface EventSource {

    /**
     * Lexes the given text. Implementations must not fail on any input; unsupported syntax is
     * reported with events the tree builder ignores, or not at all.
     *
     * @param text the Markdown source
     * @return the events in document order
     */
    List<MarkdownEvent> events(String text);
}
